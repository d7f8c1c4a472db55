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
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.RunStorePort;
import me.golemcore.scheduler.port.outbound.RunStoreException;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Removes runs past the retention period once the application has started.
 */
@Service
@Slf4j
public class RunRetentionService {

    private final RunStorePort runStore;
    private final SchedulerProperties properties;

    public RunRetentionService(RunStorePort runStore, SchedulerProperties properties) {
        this.runStore = runStore;
        this.properties = properties;
    }

    @Async
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (properties.getRuns().isPurgeOnStartup()) {
            purge();
        }
    }

    public int purge() {
        int retentionDays = properties.getRuns().getRetentionDays();
        if (retentionDays <= 0) {
            return 0;
        }
        try {
            return runStore.purgeOlderThan(retentionDays);
        } catch (RunStoreException e) {
            log.warn("[Retention] Purge failed: {}", e.getMessage());
            return 0;
        }
    }
}
