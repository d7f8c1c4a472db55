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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.CommandResult;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.ManualRunStatus;
import me.golemcore.scheduler.domain.model.RunEntry;
import me.golemcore.scheduler.domain.model.RunStatus;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.RunStorePort;
import me.golemcore.scheduler.port.outbound.RunStoreException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Runs a job immediately inside this process, outside of its schedule.
 *
 * <p>
 * Completed and failed runs are recorded in the run store like scheduled
 * ones. Cancelled runs kill the agent process and are not recorded.
 */
@Service
@Slf4j
public class ManualRunService {

    private static final Duration FINISHED_RUN_RETENTION = Duration.ofHours(1);

    private final RunStorePort runStore;
    private final AgentCommandService agentCommands;
    private final JobRunInvocation runInvocation;
    private final SchedulerProperties properties;
    private final Clock clock;
    private final Map<String, ManualRun> runs = new ConcurrentHashMap<>();
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "manual-run");
        thread.setDaemon(true);
        return thread;
    });

    public ManualRunService(RunStorePort runStore, AgentCommandService agentCommands,
            JobRunInvocation runInvocation, SchedulerProperties properties, Clock clock) {
        this.runStore = runStore;
        this.agentCommands = agentCommands;
        this.runInvocation = runInvocation;
        this.properties = properties;
        this.clock = clock;
    }

    public ManualRun start(Job job) {
        if (job == null || job.getPrompt() == null || job.getPrompt().isBlank()) {
            throw new IllegalArgumentException("Job with a prompt is required");
        }
        pruneFinished();
        ManualRun run = new ManualRun(UUID.randomUUID().toString(), job.getName(), clock.instant());
        runs.put(run.getId(), run);
        String template = runInvocation.commandFor(job);
        executor.execute(() -> execute(run, template, job.getPrompt()));
        log.info("[ManualRun] Started '{}' ({})", job.getName(), run.getId());
        return run;
    }

    public Optional<ManualRun> find(String id) {
        return Optional.ofNullable(runs.get(id));
    }

    public List<ManualRun> getRuns() {
        return List.copyOf(runs.values());
    }

    /**
     * @return false when the run is unknown or already finished
     */
    public boolean cancel(String id) {
        ManualRun run = runs.get(id);
        if (run == null) {
            return false;
        }
        boolean cancelled = run.cancel();
        if (cancelled) {
            log.info("[ManualRun] Cancelled '{}' ({})", run.getJobName(), id);
        }
        return cancelled;
    }

    private void pruneFinished() {
        Instant cutoff = clock.instant().minus(FINISHED_RUN_RETENTION);
        runs.values().removeIf(run -> run.getStatus() != ManualRunStatus.RUNNING
                && run.getStartedAt().isBefore(cutoff));
    }

    @PreDestroy
    public void shutdown() {
        runs.values().forEach(ManualRun::cancel);
        executor.shutdownNow();
    }

    void execute(ManualRun run, String template, String prompt) {
        Instant start = run.getStartedAt();
        String resolvedPrompt = agentCommands.resolvePlaceholders(prompt,
                LocalDateTime.ofInstant(start, clock.getZone()));
        String displayCommand = template.replace(AgentCommandService.PROMPT_PLACEHOLDER, resolvedPrompt);
        Duration timeout = properties.getAgent().getTimeout();

        int exitCode;
        String stdout = "";
        String stderr;
        try {
            RunningCommand command = agentCommands.start(agentCommands.buildCommandLine(template, resolvedPrompt));
            run.attach(command);
            CommandResult result = command.await(timeout, AgentCommandService.timeoutMessage(timeout));
            exitCode = result.exitCode();
            stdout = result.standardOutput();
            stderr = result.standardError();
        } catch (IOException | IllegalArgumentException e) {
            exitCode = -1;
            stderr = "Error: " + e.getMessage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.cancel();
            exitCode = -1;
            stderr = "";
        }

        ManualRunStatus finalStatus = exitCode == 0 ? ManualRunStatus.COMPLETED : ManualRunStatus.FAILED;
        if (!run.finish(finalStatus, stdout, stderr)) {
            run.complete(null);
            return;
        }

        Instant end = clock.instant();
        RunEntry entry = RunEntry.builder()
                .jobName(run.getJobName())
                .startTime(start)
                .endTime(end)
                .exitCode(exitCode)
                .status(RunStatus.fromExitCode(exitCode))
                .prompt(prompt)
                .command(displayCommand)
                .standardOutput(stdout)
                .standardError(stderr)
                .durationSeconds(Duration.between(start, end).toMillis() / 1000.0)
                .agentName(AgentCatalog.agentName(displayCommand))
                .build();
        try {
            runStore.insert(entry);
            log.info("[ManualRun] '{}' finished with exit code {}", run.getJobName(), exitCode);
        } catch (RunStoreException e) {
            log.error("[ManualRun] Failed to record run of '{}'", run.getJobName(), e);
        }
        run.complete(entry);
    }
}
