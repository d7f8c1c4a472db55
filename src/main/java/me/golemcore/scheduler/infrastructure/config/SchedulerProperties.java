package me.golemcore.scheduler.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the scheduler, bound from application.yml.
 *
 * <p>
 * All settings live under the {@code scheduler.*} prefix:
 * <ul>
 * <li>{@link AgentProperties} - default agent command and run timeout</li>
 * <li>{@link NotificationProperties} - which outcomes raise notifications</li>
 * <li>{@link RunsProperties} - run history location and retention</li>
 * <li>{@link HostProperties} - host scheduler folder and tick</li>
 * <li>{@link WatchProperties} - change detection timing</li>
 * <li>{@link StorageProperties} - workspace for tasks and result files</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "scheduler")
@Data
public class SchedulerProperties {

    private AgentProperties agent = new AgentProperties();
    private NotificationProperties notifications = new NotificationProperties();
    private RunsProperties runs = new RunsProperties();
    private HostProperties host = new HostProperties();
    private WatchProperties watch = new WatchProperties();
    private StorageProperties storage = new StorageProperties();

    @Data
    public static class AgentProperties {
        private String command = "claude -p \"{prompt}\" --dangerously-skip-permissions";
        // Manual runs only. Detached runs use JobRunner.DETACHED_RUN_TIMEOUT.
        private Duration timeout = Duration.ofMinutes(10);
        private Duration validationTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class NotificationProperties {
        private boolean onSuccess = true;
        private boolean onFailure = true;
    }

    @Data
    public static class RunsProperties {
        private String directory = "${user.home}/.golemcore/scheduler/runs";
        private int retentionDays = 30;
        private boolean purgeOnStartup = true;

        public Path resolveDirectory() {
            return resolvePath(directory);
        }
    }

    @Data
    public static class HostProperties {
        private boolean enabled = true;
        private String taskFolder = "GolemCore";
        private Duration tickInterval = Duration.ofSeconds(1);
        private Duration executionTimeLimit = Duration.ofHours(1);
        /**
         * Command prefix that starts this application. Empty means the
         * current JVM and class path.
         */
        private List<String> launcher = new ArrayList<>();
    }

    @Data
    public static class WatchProperties {
        private boolean enabled = true;
        private Duration debounce = Duration.ofMillis(500);
        private Duration pollInterval = Duration.ofSeconds(30);
        private Duration jobsPollInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.golemcore/scheduler";
        private String resultsDirectory = "results";
        private String tasksDirectory = "tasks";

        public Path resolveBasePath() {
            return resolvePath(basePath);
        }
    }

    static Path resolvePath(String value) {
        return Paths.get(value.replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
    }
}
