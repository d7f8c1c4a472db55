package me.golemcore.scheduler.adapter.inbound.watch;

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
import me.golemcore.scheduler.adapter.outbound.runstore.SqliteRunStoreAdapter;
import me.golemcore.scheduler.domain.service.RunSyncService;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns changes to the run database into scans for new runs.
 *
 * <p>
 * File events on the database and its journal files are debounced: every
 * event restarts the quiet period, and one scan is requested when it elapses.
 * A periodic poll covers file systems that do not deliver events.
 */
@Component
@Slf4j
public class RunStoreWatcher {

    private final RunSyncService runSync;
    private final SchedulerProperties properties;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> pendingScan;
    private volatile WatchService watchService;
    private volatile Thread watchThread;

    public RunStoreWatcher(RunSyncService runSync, SchedulerProperties properties) {
        this.runSync = runSync;
        this.properties = properties;
    }

    @PostConstruct
    public void start() {
        if (!properties.getWatch().isEnabled() || !running.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "run-store-scan");
            t.setDaemon(true);
            return t;
        });
        long pollMillis = properties.getWatch().getPollInterval().toMillis();
        executor.scheduleWithFixedDelay(this::scan, pollMillis, pollMillis, TimeUnit.MILLISECONDS);
        startWatching(properties.getRuns().resolveDirectory());
    }

    @PreDestroy
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        runSync.stop();
        if (watchService != null) {
            try {
                watchService.close();
            } catch (IOException e) {
                log.warn("[RunWatch] Error closing watch service: {}", e.getMessage());
            }
        }
        if (watchThread != null) {
            watchThread.interrupt();
        }
        executor.shutdownNow();
    }

    /**
     * Schedule a scan after the quiet period, replacing one that is still
     * pending.
     */
    public synchronized void onChange() {
        if (executor == null || executor.isShutdown()) {
            return;
        }
        if (pendingScan != null) {
            pendingScan.cancel(false);
        }
        long debounceMillis = properties.getWatch().getDebounce().toMillis();
        pendingScan = executor.schedule(this::scan, debounceMillis, TimeUnit.MILLISECONDS);
    }

    static boolean isRunStoreFile(Path changed) {
        return changed != null && changed.getFileName().toString().startsWith(SqliteRunStoreAdapter.DATABASE_FILE);
    }

    private void scan() {
        try {
            runSync.requestScan();
        } catch (RuntimeException e) {
            log.error("[RunWatch] Scan failed", e);
        }
    }

    private void startWatching(Path directory) {
        try {
            Files.createDirectories(directory);
            watchService = FileSystems.getDefault().newWatchService();
            directory.register(watchService, StandardWatchEventKinds.ENTRY_CREATE,
                    StandardWatchEventKinds.ENTRY_MODIFY);
        } catch (IOException e) {
            log.error("[RunWatch] Failed to watch {}, relying on polling: {}", directory, e.getMessage());
            return;
        }

        watchThread = new Thread(() -> {
            log.info("[RunWatch] Watching {}", directory);
            while (running.get()) {
                try {
                    WatchKey key = watchService.take();
                    boolean relevant = false;
                    for (WatchEvent<?> event : key.pollEvents()) {
                        if (event.kind() == StandardWatchEventKinds.OVERFLOW
                                || event.context() instanceof Path changed && isRunStoreFile(changed)) {
                            relevant = true;
                        }
                    }
                    key.reset();
                    if (relevant) {
                        onChange();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (ClosedWatchServiceException e) {
                    break;
                }
            }
            log.info("[RunWatch] Watcher stopped");
        }, "run-store-watcher");
        watchThread.setDaemon(true);
        watchThread.start();
    }
}
