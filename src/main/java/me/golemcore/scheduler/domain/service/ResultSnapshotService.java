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
import me.golemcore.scheduler.domain.model.RunEntry;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.CompletableFuture;

/**
 * Saves the readable result of each run under
 * {@code results/<job>/<yyyyMMdd_HHmmss>_SUCCESS|FAILED.txt}. Best effort:
 * failures are logged and never propagate.
 */
@Service
@Slf4j
public class ResultSnapshotService {

    static final String NO_OUTPUT = "*No output captured.*";

    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final StoragePort storagePort;
    private final SchedulerProperties properties;
    private final Clock clock;

    public ResultSnapshotService(StoragePort storagePort, SchedulerProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.properties = properties;
        this.clock = clock;
    }

    public CompletableFuture<Void> save(RunEntry entry) {
        String path;
        try {
            path = pathFor(entry);
        } catch (RuntimeException e) {
            log.warn("[Results] Cannot derive result path for run {}: {}", entry.getId(), e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        String directory = properties.getStorage().getResultsDirectory();
        return storagePort.putText(directory, path, render(entry))
                .exceptionally(e -> {
                    log.warn("[Results] Failed to save result of '{}': {}", entry.getJobName(), e.getMessage());
                    return null;
                });
    }

    String pathFor(RunEntry entry) {
        String stamp = STAMP.format(entry.getStartTime().atZone(clock.getZone()));
        String status = entry.isSuccess() ? "SUCCESS" : "FAILED";
        return FileNames.sanitize(entry.getJobName()) + "/" + stamp + "_" + status + ".txt";
    }

    static String render(RunEntry entry) {
        String nl = System.lineSeparator();
        StringBuilder content = new StringBuilder();
        if (entry.getStandardOutput() != null) {
            content.append(entry.getStandardOutput().strip());
        }
        String error = entry.getStandardError();
        if (!entry.isSuccess() && error != null && !error.isBlank()) {
            if (content.length() > 0) {
                content.append(nl).append(nl);
            }
            content.append("--- ERROR ---").append(nl).append(error.strip());
        }
        if (content.length() == 0) {
            content.append(NO_OUTPUT);
        }
        return content.toString();
    }
}
