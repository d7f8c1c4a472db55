package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.model.RunsRefreshedEvent;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.infrastructure.event.RunEventChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JobChangeMonitorTest {

    private JobRegistryService jobRegistry;
    private JobChangeMonitor monitor;
    private final List<RunsRefreshedEvent> refreshes = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        jobRegistry = mock(JobRegistryService.class);
        RunEventChannel channel = new RunEventChannel();
        channel.refreshes().subscribe(refreshes::add);
        monitor = new JobChangeMonitor(jobRegistry, channel, new SchedulerProperties(),
                Clock.fixed(Instant.parse("2026-03-10T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void shouldTreatFirstCheckAsBaseline() {
        when(jobRegistry.getJobNames()).thenReturn(List.of("Digest"));

        assertFalse(monitor.check());
        assertTrue(refreshes.isEmpty());
    }

    @Test
    void shouldPublishRefreshWhenJobSetChanges() {
        when(jobRegistry.getJobNames())
                .thenReturn(List.of("Digest"))
                .thenReturn(List.of("Digest", "Cleanup"));

        monitor.check();

        assertTrue(monitor.check());
        assertEquals(1, refreshes.size());
        assertEquals(RunsRefreshedEvent.Reason.JOBS_CHANGED, refreshes.get(0).reason());
    }

    @Test
    void shouldIgnoreCaseAndOrderDifferences() {
        when(jobRegistry.getJobNames())
                .thenReturn(List.of("Digest", "Cleanup"))
                .thenReturn(List.of("cleanup", "DIGEST"));

        monitor.check();

        assertFalse(monitor.check());
        assertTrue(refreshes.isEmpty());
    }

    @Test
    void shouldSurviveRegistryFailure() {
        when(jobRegistry.getJobNames()).thenThrow(new IllegalStateException("unavailable"));

        assertFalse(monitor.check());
    }
}
