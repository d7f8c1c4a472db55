package me.golemcore.scheduler.adapter.inbound.cli;

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
import me.golemcore.scheduler.adapter.outbound.runstore.SqliteRunStoreAdapter;
import me.golemcore.scheduler.domain.service.AgentCommandService;
import me.golemcore.scheduler.domain.service.JobRunArguments;
import me.golemcore.scheduler.domain.service.JobRunner;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.RunStoreException;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Entry point of the detached job runner started by the host scheduler. Runs
 * without the application context so that a fired job starts quickly and does
 * not bind the web port.
 *
 * <p>
 * Application properties are not loaded here, so {@code scheduler.agent.timeout}
 * does not apply: every detached run is limited to
 * {@link JobRunner#DETACHED_RUN_TIMEOUT}.
 */
@Slf4j
public final class RunJobCommand {

    public static final int USAGE_ERROR = 2;

    private RunJobCommand() {
    }

    public static int run(String[] args) {
        Optional<JobRunArguments> parsed = JobRunArguments.parse(args);
        if (parsed.isEmpty()) {
            log.error("[JobRunner] Usage: --run-job <name> --command <template> --prompt <prompt> --logs <dir>");
            return USAGE_ERROR;
        }
        JobRunArguments arguments = parsed.get();
        Clock clock = Clock.systemDefaultZone();
        Duration timeout = JobRunner.DETACHED_RUN_TIMEOUT;
        try {
            SqliteRunStoreAdapter runStore = new SqliteRunStoreAdapter(logsDirectory(arguments), clock);
            return new JobRunner(runStore, new AgentCommandService(clock), clock, timeout).run(arguments);
        } catch (RunStoreException e) {
            log.error("[JobRunner] Run store unavailable for job '{}'", arguments.jobName(), e);
            return JobRunner.INTERNAL_FAILURE;
        }
    }

    private static Path logsDirectory(JobRunArguments arguments) {
        String directory = arguments.logsDirectory();
        if (directory == null || directory.isBlank()) {
            return new SchedulerProperties().getRuns().resolveDirectory();
        }
        return Paths.get(directory);
    }
}
