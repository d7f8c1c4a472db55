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

import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.task.ExecAction;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the host scheduler action that re-launches this application in job
 * runner mode.
 */
@Component
public class JobRunInvocation {

    private static final String MAIN_CLASS = "me.golemcore.scheduler.SchedulerApplication";

    private final SchedulerProperties properties;

    public JobRunInvocation(SchedulerProperties properties) {
        this.properties = properties;
    }

    public ExecAction actionFor(Job job) {
        List<String> launcher = launcher();
        JobRunArguments arguments = new JobRunArguments(job.getName(), commandFor(job), job.getPrompt(),
                properties.getRuns().resolveDirectory().toString());
        List<String> actionArguments = new ArrayList<>(launcher.subList(1, launcher.size()));
        actionArguments.addAll(arguments.toArguments());
        return new ExecAction(launcher.get(0), actionArguments);
    }

    /**
     * The job's own agent command when set, otherwise the configured default.
     */
    public String commandFor(Job job) {
        String override = job.getAgentOverride();
        return override != null && !override.isBlank() ? override : properties.getAgent().getCommand();
    }

    private List<String> launcher() {
        List<String> configured = properties.getHost().getLauncher();
        if (configured != null && !configured.isEmpty()) {
            return configured;
        }
        String javaBinary = ProcessHandle.current().info().command()
                .orElse(Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        return List.of(javaBinary, "-cp", System.getProperty("java.class.path"), MAIN_CLASS);
    }
}
