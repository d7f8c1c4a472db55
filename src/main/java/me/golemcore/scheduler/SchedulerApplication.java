package me.golemcore.scheduler;

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

import me.golemcore.scheduler.adapter.inbound.cli.RunJobCommand;
import me.golemcore.scheduler.domain.service.JobRunArguments;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Main application class for GolemCore Scheduler.
 *
 * <p>
 * GolemCore Scheduler runs prompts through CLI coding agents on recurring
 * schedules. Jobs are stored as host scheduler tasks; each fired task starts
 * this application again in job runner mode, which records the outcome in the
 * run store.
 *
 * <h2>Modes</h2>
 * <ul>
 * <li><b>Service</b> - job management API, run history, change detection and
 * notifications</li>
 * <li><b>Job runner</b> - {@code --run-job ...}, runs one job and exits with
 * the agent's exit code</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → REST controllers, run store watcher, job runner CLI
 * Domain Layer       → JobRegistryService, RunSyncService, TriggerTranslator
 * Infrastructure     → Host scheduler, SQLite run store, storage adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code scheduler.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableAsync
public class SchedulerApplication {

    public static void main(String[] args) {
        if (JobRunArguments.isRunJobInvocation(args)) {
            System.exit(RunJobCommand.run(args));
        }
        SpringApplication.run(SchedulerApplication.class, args);
    }

}
