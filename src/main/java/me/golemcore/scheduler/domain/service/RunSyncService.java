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

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobNotification;
import me.golemcore.scheduler.domain.model.RunEntry;
import me.golemcore.scheduler.domain.model.RunsRefreshedEvent;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.infrastructure.event.RunEventChannel;
import me.golemcore.scheduler.port.outbound.RunStorePort;
import me.golemcore.scheduler.port.outbound.RunStoreException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Picks up runs that detached job runners appended to the run store and turns
 * each of them into at most one notification.
 *
 * <p>
 * Progress is tracked by a high-water mark over run ids, seeded from the
 * store's maximum id at startup and never persisted. Runs appended while the
 * application was down are therefore not notified.
 *
 * <p>
 * Scans are single-flight. A scan requested while another is running does
 * not wait: it marks the running scan for one more pass and returns. Any
 * number of requests during a pass coalesce into a single extra pass.
 */
@Service
@Slf4j
public class RunSyncService {

    private final RunStorePort runStore;
    private final JobRegistryService jobRegistry;
    private final ResultSnapshotService resultSnapshots;
    private final RunEventChannel eventChannel;
    private final SchedulerProperties properties;
    private final Clock clock;

    private final AtomicLong lastProcessedId = new AtomicLong(0);
    private final AtomicBoolean cursorInitialized = new AtomicBoolean(false);
    private final AtomicBoolean scanInProgress = new AtomicBoolean(false);
    private final AtomicBoolean scanQueued = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public RunSyncService(RunStorePort runStore, JobRegistryService jobRegistry,
            ResultSnapshotService resultSnapshots, RunEventChannel eventChannel, SchedulerProperties properties,
            Clock clock) {
        this.runStore = runStore;
        this.jobRegistry = jobRegistry;
        this.resultSnapshots = resultSnapshots;
        this.eventChannel = eventChannel;
        this.properties = properties;
        this.clock = clock;
    }

    public enum Outcome {
        NOTIFIED, SKIPPED_NO_JOB, SKIPPED_SILENT, SKIPPED_DISABLED_PREFERENCE
    }

    public record RunDecision(long runId, String jobName, Outcome outcome) {
    }

    public record ScanResult(List<RunDecision> decisions, long lastProcessedId) {

        static ScanResult empty(long lastProcessedId) {
            return new ScanResult(List.of(), lastProcessedId);
        }

        public int processed() {
            return decisions.size();
        }
    }

    @PostConstruct
    public void initialize() {
        try {
            long maxId = runStore.maxId();
            lastProcessedId.set(maxId);
            cursorInitialized.set(true);
            log.info("[RunSync] Starting after run id {}", maxId);
        } catch (RunStoreException e) {
            log.warn("[RunSync] Run store unavailable, cursor will be seeded on first scan: {}", e.getMessage());
        }
    }

    /**
     * Request a scan for new runs. Runs the scan on the calling thread unless
     * one is already in flight.
     */
    public void requestScan() {
        scanQueued.set(true);
        while (scanQueued.get() && !stopped.get()) {
            if (!scanInProgress.compareAndSet(false, true)) {
                return;
            }
            try {
                while (!stopped.get() && scanQueued.getAndSet(false)) {
                    processNewRuns();
                }
            } finally {
                scanInProgress.set(false);
            }
        }
    }

    /**
     * Stop scheduling further scans. A scan in flight runs to completion.
     */
    public void stop() {
        stopped.set(true);
    }

    public boolean isScanInProgress() {
        return scanInProgress.get();
    }

    public long getLastProcessedId() {
        return lastProcessedId.get();
    }

    /**
     * One pass over runs newer than the cursor, in ascending id order.
     */
    public ScanResult processNewRuns() {
        if (!cursorInitialized.get()) {
            initialize();
            if (!cursorInitialized.get()) {
                return ScanResult.empty(lastProcessedId.get());
            }
        }

        List<RunEntry> runs;
        try {
            runs = runStore.findAfter(lastProcessedId.get());
        } catch (RunStoreException e) {
            log.warn("[RunSync] Run store unavailable, will retry on next change: {}", e.getMessage());
            return ScanResult.empty(lastProcessedId.get());
        }
        if (runs.isEmpty()) {
            return ScanResult.empty(lastProcessedId.get());
        }

        List<Job> jobs = jobRegistry.getAllJobs();
        List<RunDecision> decisions = new ArrayList<>(runs.size());
        for (RunEntry run : runs) {
            lastProcessedId.accumulateAndGet(run.getId(), Math::max);
            Outcome outcome = decide(run, findJob(jobs, run.getJobName()));
            decisions.add(new RunDecision(run.getId(), run.getJobName(), outcome));
            // Deleted jobs get no new result folders.
            if (outcome != Outcome.SKIPPED_NO_JOB) {
                resultSnapshots.save(run);
            }
        }

        long cursor = lastProcessedId.get();
        log.debug("[RunSync] Processed {} run(s), cursor at {}", runs.size(), cursor);
        eventChannel.publishRefresh(new RunsRefreshedEvent(RunsRefreshedEvent.Reason.NEW_RUNS, cursor, runs.size(),
                clock.instant()));
        return new ScanResult(decisions, cursor);
    }

    private Outcome decide(RunEntry run, Optional<Job> job) {
        if (job.isEmpty()) {
            return Outcome.SKIPPED_NO_JOB;
        }
        if (job.get().isSilent()) {
            return Outcome.SKIPPED_SILENT;
        }
        boolean success = run.isSuccess();
        SchedulerProperties.NotificationProperties preferences = properties.getNotifications();
        if (success ? !preferences.isOnSuccess() : !preferences.isOnFailure()) {
            return Outcome.SKIPPED_DISABLED_PREFERENCE;
        }
        eventChannel.publishNotification(buildNotification(run, job.get()));
        return Outcome.NOTIFIED;
    }

    static JobNotification buildNotification(RunEntry run, Job job) {
        boolean success = run.isSuccess();
        String title = (success ? "Job Completed: " : "Job Failed: ") + run.getJobName();
        String message = success
                ? String.format(Locale.ROOT, "Completed successfully in %.1fs", run.getDurationSeconds())
                : "Failed with exit code " + run.getExitCode();
        return new JobNotification(run.getId(), run.getJobName(), success, title, message,
                OutputPreview.of(run.getStandardOutput()), job.getHexColor(), job.getIcon());
    }

    private static Optional<Job> findJob(List<Job> jobs, String name) {
        return jobs.stream().filter(job -> job.hasName(name)).findFirst();
    }
}
