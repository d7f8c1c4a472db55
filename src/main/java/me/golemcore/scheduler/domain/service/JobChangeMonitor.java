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
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.RunsRefreshedEvent;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.infrastructure.event.RunEventChannel;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Notices jobs added or removed in the task folder by something other than
 * this application and asks views to refresh.
 */
@Service
@Slf4j
public class JobChangeMonitor {

    private final JobRegistryService jobRegistry;
    private final RunEventChannel eventChannel;
    private final SchedulerProperties properties;
    private final Clock clock;

    private volatile Set<String> knownJobs;
    private ScheduledExecutorService executor;

    public JobChangeMonitor(JobRegistryService jobRegistry, RunEventChannel eventChannel,
            SchedulerProperties properties, Clock clock) {
        this.jobRegistry = jobRegistry;
        this.eventChannel = eventChannel;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        if (!properties.getWatch().isEnabled()) {
            return;
        }
        long periodMillis = properties.getWatch().getJobsPollInterval().toMillis();
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "job-change-monitor");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::check, periodMillis, periodMillis, TimeUnit.MILLISECONDS);
        log.info("[JobMonitor] Polling task folder every {} ms", periodMillis);
    }

    @PreDestroy
    public void stop() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /**
     * Compare the current job names against the last observation.
     *
     * @return whether a change was detected
     */
    public boolean check() {
        try {
            Set<String> current = normalize(jobRegistry.getJobNames());
            Set<String> previous = knownJobs;
            knownJobs = current;
            if (previous == null || previous.equals(current)) {
                return false;
            }
            log.info("[JobMonitor] Job set changed outside the application ({} -> {} jobs)", previous.size(),
                    current.size());
            eventChannel.publishRefresh(new RunsRefreshedEvent(RunsRefreshedEvent.Reason.JOBS_CHANGED, 0, 0,
                    clock.instant()));
            return true;
        } catch (RuntimeException e) {
            log.warn("[JobMonitor] Check failed: {}", e.getMessage());
            return false;
        }
    }

    private static Set<String> normalize(List<String> names) {
        Set<String> normalized = new TreeSet<>();
        for (String name : names) {
            normalized.add(name.toLowerCase(Locale.ROOT));
        }
        return normalized;
    }
}
