package me.golemcore.scheduler.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.CommandResult;
import me.golemcore.scheduler.domain.model.RunEntry;
import me.golemcore.scheduler.domain.model.RunStatus;
import me.golemcore.scheduler.port.outbound.RunStorePort;
import me.golemcore.scheduler.port.outbound.RunStoreException;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Executes one scheduled job run in a detached process and records exactly
 * one {@link RunEntry}.
 *
 * <p>
 * Agent failures, launch failures and timeouts are all recorded as runs with
 * a non-zero exit code. Only a failure to record the run itself is reported
 * as an internal failure.
 */
@Slf4j
public class JobRunner {

    public static final int INTERNAL_FAILURE = 1;
    public static final Duration DETACHED_RUN_TIMEOUT = Duration.ofMinutes(10);

    private static final DateTimeFormatter LOG_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final RunStorePort runStore;
    private final AgentCommandService agentCommands;
    private final Clock clock;
    private final Duration timeout;

    public JobRunner(RunStorePort runStore, AgentCommandService agentCommands, Clock clock, Duration timeout) {
        this.runStore = runStore;
        this.agentCommands = agentCommands;
        this.clock = clock;
        this.timeout = timeout;
    }

    /**
     * @return the agent's exit code, -1 for a timeout or launch failure, or
     *         {@link #INTERNAL_FAILURE} when the run could not be recorded
     */
    public int run(JobRunArguments arguments) {
        Instant start = clock.instant();
        LocalDateTime localStart = LocalDateTime.ofInstant(start, clock.getZone());
        String resolvedPrompt = agentCommands.resolvePlaceholders(arguments.prompt(), localStart);
        String displayCommand = arguments.command().replace(AgentCommandService.PROMPT_PLACEHOLDER, resolvedPrompt);

        log.info("[JobRunner] Running job '{}'", arguments.jobName());
        int exitCode;
        String stdout = "";
        String stderr = "";
        try {
            List<String> commandLine = agentCommands.buildCommandLine(arguments.command(), resolvedPrompt);
            CommandResult result = agentCommands.execute(commandLine, timeout);
            exitCode = result.exitCode();
            stdout = result.standardOutput();
            stderr = result.standardError();
        } catch (IOException | IllegalArgumentException e) {
            exitCode = -1;
            stderr = "Failed to execute command: " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            exitCode = -1;
            stderr = "Failed to execute command: interrupted";
        }

        Instant end = clock.instant();
        RunEntry entry = RunEntry.builder()
                .jobName(arguments.jobName())
                .startTime(start)
                .endTime(end)
                .exitCode(exitCode)
                .status(RunStatus.fromExitCode(exitCode))
                .prompt(arguments.prompt())
                .command(displayCommand)
                .standardOutput(stdout)
                .standardError(stderr)
                .durationSeconds(Duration.between(start, end).toMillis() / 1000.0)
                .agentName(AgentCatalog.agentName(displayCommand))
                .logFilePath(logFilePath(arguments, localStart))
                .build();

        try {
            long id = runStore.insert(entry);
            log.info("[JobRunner] Job '{}' finished with exit code {} (run {})", arguments.jobName(), exitCode, id);
        } catch (RunStoreException e) {
            log.error("[JobRunner] Failed to record run of '{}'", arguments.jobName(), e);
            return INTERNAL_FAILURE;
        }
        return exitCode;
    }

    private static String logFilePath(JobRunArguments arguments, LocalDateTime start) {
        String fileName = FileNames.sanitize(arguments.jobName()) + "_" + LOG_STAMP.format(start) + ".log";
        String directory = arguments.logsDirectory() != null ? arguments.logsDirectory() : "";
        Path path = directory.isEmpty() ? Paths.get(fileName) : Paths.get(directory).resolve(fileName);
        return path.toString();
    }
}
