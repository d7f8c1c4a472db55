package me.golemcore.scheduler.adapter.inbound.watch;

import me.golemcore.scheduler.domain.service.RunSyncService;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

class RunStoreWatcherTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRecognizeDatabaseAndJournalFiles() {
        assertTrue(RunStoreWatcher.isRunStoreFile(Paths.get("runs.db")));
        assertTrue(RunStoreWatcher.isRunStoreFile(Paths.get("runs.db-wal")));
        assertTrue(RunStoreWatcher.isRunStoreFile(Paths.get("runs.db-shm")));
        assertFalse(RunStoreWatcher.isRunStoreFile(Paths.get("Digest_20260310_090000.log")));
        assertFalse(RunStoreWatcher.isRunStoreFile(null));
    }

    @Test
    void shouldCollapseBurstOfChangesIntoOneScan() {
        RunSyncService runSync = mock(RunSyncService.class);
        SchedulerProperties properties = new SchedulerProperties();
        properties.getRuns().setDirectory(tempDir.toString());
        properties.getWatch().setDebounce(Duration.ofMillis(100));
        properties.getWatch().setPollInterval(Duration.ofHours(1));
        RunStoreWatcher watcher = new RunStoreWatcher(runSync, properties);
        watcher.start();
        try {
            watcher.onChange();
            watcher.onChange();
            watcher.onChange();

            verify(runSync, timeout(2000).times(1)).requestScan();
        } finally {
            watcher.stop();
        }
        verify(runSync).stop();
    }

    @Test
    void shouldStayIdleWhenWatchingIsDisabled() {
        RunSyncService runSync = mock(RunSyncService.class);
        SchedulerProperties properties = new SchedulerProperties();
        properties.getWatch().setEnabled(false);
        RunStoreWatcher watcher = new RunStoreWatcher(runSync, properties);

        watcher.start();
        watcher.stop();

        verify(runSync, never()).requestScan();
        verify(runSync, never()).stop();
    }
}
