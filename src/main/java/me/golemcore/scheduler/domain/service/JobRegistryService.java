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
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.task.ScheduledTask;
import me.golemcore.scheduler.domain.model.task.TaskDefinition;
import me.golemcore.scheduler.domain.model.trigger.Trigger;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.HostSchedulerPort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Domain service that owns job identity. Jobs are stored as host scheduler
 * tasks in the configured folder, with their metadata in the task
 * description and their schedule as triggers.
 *
 * <p>
 * Invalid arguments are rejected with {@link IllegalArgumentException}, name
 * clashes with {@link IllegalStateException}. Tasks in the folder that were
 * not written by this service are skipped.
 */
@Service
@Slf4j
public class JobRegistryService {

    /**
     * Host schedulers report a placeholder date for tasks that never ran.
     */
    private static final Instant FIRST_REAL_RUN = Instant.parse("2001-01-01T00:00:00Z");

    private final HostSchedulerPort hostScheduler;
    private final TriggerTranslator triggerTranslator;
    private final JobMetadataCodec metadataCodec;
    private final JobRunInvocation runInvocation;
    private final SchedulerProperties properties;

    public JobRegistryService(HostSchedulerPort hostScheduler, TriggerTranslator triggerTranslator,
            JobMetadataCodec metadataCodec, JobRunInvocation runInvocation, SchedulerProperties properties) {
        this.hostScheduler = hostScheduler;
        this.triggerTranslator = triggerTranslator;
        this.metadataCodec = metadataCodec;
        this.runInvocation = runInvocation;
        this.properties = properties;
    }

    public boolean isSchedulerAvailable() {
        try {
            return hostScheduler.isAvailable();
        } catch (RuntimeException e) {
            log.warn("[JobRegistry] Host scheduler check failed: {}", e.getMessage());
            return false;
        }
    }

    public List<Job> getAllJobs() {
        List<Job> jobs = new ArrayList<>();
        try {
            for (ScheduledTask task : hostScheduler.listTasks(folder())) {
                toJob(task).ifPresent(jobs::add);
            }
        } catch (RuntimeException e) {
            log.error("[JobRegistry] Failed to list jobs", e);
        }
        return jobs;
    }

    public List<String> getJobNames() {
        return getAllJobs().stream().map(Job::getName).toList();
    }

    public Optional<Job> findJob(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return getAllJobs().stream().filter(job -> job.hasName(name)).findFirst();
    }

    public void createJob(Job job) {
        validateJob(job);
        if (hostScheduler.findTask(folder(), job.getName()).isPresent()) {
            throw new IllegalStateException("Job already exists: " + job.getName());
        }
        hostScheduler.registerTask(folder(), job.getName(), buildDefinition(job));
        if (!job.isEnabled()) {
            hostScheduler.setEnabled(folder(), job.getName(), false);
        }
        log.info("[JobRegistry] Created job '{}'", job.getName());
    }

    /**
     * Replace a job's definition. A new name is applied by registering the
     * job under it and deleting the original task.
     */
    public void updateJob(String originalName, Job job) {
        validateJob(job);
        if (hostScheduler.findTask(folder(), originalName).isEmpty()) {
            throw new IllegalArgumentException("Job not found: " + originalName);
        }
        boolean renamed = !job.hasName(originalName);
        if (renamed && hostScheduler.findTask(folder(), job.getName()).isPresent()) {
            throw new IllegalStateException("Job already exists: " + job.getName());
        }

        hostScheduler.registerTask(folder(), job.getName(), buildDefinition(job));
        hostScheduler.setEnabled(folder(), job.getName(), job.isEnabled());
        if (renamed) {
            hostScheduler.deleteTask(folder(), originalName);
            log.info("[JobRegistry] Renamed job '{}' to '{}'", originalName, job.getName());
        } else {
            log.info("[JobRegistry] Updated job '{}'", job.getName());
        }
    }

    public void deleteJob(String name) {
        requireName(name);
        hostScheduler.deleteTask(folder(), name);
        log.info("[JobRegistry] Deleted job '{}'", name);
    }

    public void setJobEnabled(String name, boolean enabled) {
        requireName(name);
        hostScheduler.setEnabled(folder(), name, enabled);
        log.info("[JobRegistry] Job '{}' {}", name, enabled ? "enabled" : "disabled");
    }

    public int pauseAllJobs() {
        return setAllEnabled(false);
    }

    public int resumeAllJobs() {
        return setAllEnabled(true);
    }

    /**
     * Re-register every job so that a changed default agent command reaches
     * the host scheduler.
     *
     * @return number of jobs updated
     */
    public int updateAllJobs() {
        int updated = 0;
        for (Job job : getAllJobs()) {
            try {
                hostScheduler.registerTask(folder(), job.getName(), buildDefinition(job));
                updated++;
            } catch (RuntimeException e) {
                log.warn("[JobRegistry] Failed to update job '{}': {}", job.getName(), e.getMessage());
            }
        }
        log.info("[JobRegistry] Re-registered {} job(s)", updated);
        return updated;
    }

    public Optional<Instant> getNextRunTime(String name) {
        return findJob(name).map(Job::getNextRunTime);
    }

    public Optional<Instant> getLastRunTime(String name) {
        return findJob(name).map(Job::getLastRunTime);
    }

    private int setAllEnabled(boolean enabled) {
        int changed = 0;
        for (Job job : getAllJobs()) {
            if (job.isEnabled() == enabled) {
                continue;
            }
            try {
                hostScheduler.setEnabled(folder(), job.getName(), enabled);
                changed++;
            } catch (RuntimeException e) {
                log.warn("[JobRegistry] Failed to {} job '{}': {}", enabled ? "resume" : "pause", job.getName(),
                        e.getMessage());
            }
        }
        log.info("[JobRegistry] {} {} job(s)", enabled ? "Resumed" : "Paused", changed);
        return changed;
    }

    private TaskDefinition buildDefinition(Job job) {
        List<Trigger> triggers = triggerTranslator.toTriggers(job.getSchedule());
        if (triggers.isEmpty()) {
            log.warn("[JobRegistry] Schedule of job '{}' selects no days, it will never run", job.getName());
        }
        return TaskDefinition.builder()
                .description(metadataCodec.encode(job))
                .triggers(new ArrayList<>(triggers))
                .action(runInvocation.actionFor(job))
                .executionTimeLimit(properties.getHost().getExecutionTimeLimit())
                .startWhenAvailable(true)
                .build();
    }

    private Optional<Job> toJob(ScheduledTask task) {
        TaskDefinition definition = task.getDefinition();
        if (definition == null || !metadataCodec.isManagedTask(definition.getDescription())) {
            return Optional.empty();
        }
        return metadataCodec.decode(definition.getDescription()).map(metadata -> Job.builder()
                .name(task.getName())
                .prompt(metadata.prompt())
                .silent(metadata.silent())
                .agentOverride(metadata.agentOverride())
                .hexColor(metadata.hexColor())
                .icon(metadata.icon())
                .schedule(triggerTranslator.fromTriggers(definition.getTriggers()))
                .enabled(task.isEnabled())
                .lastRunTime(realRunTime(task.getLastRunTime()))
                .nextRunTime(task.getNextRunTime())
                .running(task.getState() == ScheduledTask.TaskState.RUNNING)
                .build());
    }

    private static Instant realRunTime(Instant time) {
        return time != null && !time.isBefore(FIRST_REAL_RUN) ? time : null;
    }

    private static void validateJob(Job job) {
        if (job == null) {
            throw new IllegalArgumentException("Job is required");
        }
        requireName(job.getName());
        if (job.getPrompt() == null || job.getPrompt().isBlank()) {
            throw new IllegalArgumentException("Job prompt is required");
        }
        if (job.getSchedule() == null) {
            throw new IllegalArgumentException("Job schedule is required");
        }
        job.getSchedule().validate();
    }

    private static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name is required");
        }
    }

    private String folder() {
        return properties.getHost().getTaskFolder();
    }
}
