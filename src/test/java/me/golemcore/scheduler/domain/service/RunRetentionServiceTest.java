package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.RunStoreException;
import me.golemcore.scheduler.port.outbound.RunStorePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RunRetentionServiceTest {

    private RunStorePort runStore;
    private SchedulerProperties properties;
    private RunRetentionService service;

    @BeforeEach
    void setUp() {
        runStore = mock(RunStorePort.class);
        properties = new SchedulerProperties();
        service = new RunRetentionService(runStore, properties);
    }

    @Test
    void shouldPurgeWithConfiguredRetention() {
        properties.getRuns().setRetentionDays(14);
        when(runStore.purgeOlderThan(14)).thenReturn(3);

        assertEquals(3, service.purge());
    }

    @Test
    void shouldKeepEverythingWhenRetentionIsDisabled() {
        properties.getRuns().setRetentionDays(0);

        assertEquals(0, service.purge());
        verify(runStore, never()).purgeOlderThan(anyInt());
    }

    @Test
    void shouldReturnZeroWhenStoreFails() {
        when(runStore.purgeOlderThan(30)).thenThrow(new RunStoreException("locked", new SQLException("busy")));

        assertEquals(0, service.purge());
    }

    @Test
    void shouldSkipStartupPurgeWhenDisabled() {
        properties.getRuns().setPurgeOnStartup(false);

        service.onApplicationReady();

        verify(runStore, never()).purgeOlderThan(anyInt());
    }

    @Test
    void shouldPurgeOnStartup() {
        service.onApplicationReady();

        verify(runStore).purgeOlderThan(30);
    }
}
