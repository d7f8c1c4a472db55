package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.model.RunEntry;
import me.golemcore.scheduler.domain.model.RunStatus;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ResultSnapshotServiceTest {

    private static final Instant STARTED = Instant.parse("2026-03-10T08:05:09Z");
    private static final String NL = System.lineSeparator();

    private StoragePort storagePort;
    private ResultSnapshotService service;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        service = new ResultSnapshotService(storagePort, new SchedulerProperties(),
                Clock.fixed(STARTED, ZoneOffset.UTC));
    }

    @Test
    void shouldWriteSuccessfulRunUnderJobDirectory() {
        when(storagePort.putText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));

        service.save(run("Daily: digest?", RunStatus.SUCCESS, " summary \n", "warning")).join();

        verify(storagePort).putText("results", "Daily_ digest_/20260310_080509_SUCCESS.txt", "summary");
    }

    @Test
    void shouldAppendErrorBlockForFailedRun() {
        assertEquals("partial" + NL + NL + "--- ERROR ---" + NL + "boom",
                ResultSnapshotService.render(run("Job", RunStatus.FAILURE, "partial", "boom\n")));
    }

    @Test
    void shouldNoteMissingOutput() {
        assertEquals(ResultSnapshotService.NO_OUTPUT,
                ResultSnapshotService.render(run("Job", RunStatus.SUCCESS, "", "")));
        assertEquals("--- ERROR ---" + NL + "boom",
                ResultSnapshotService.render(run("Job", RunStatus.FAILURE, null, "boom")));
    }

    @Test
    void shouldSwallowStorageFailures() {
        when(storagePort.putText(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        CompletableFuture<Void> result = service.save(run("Job", RunStatus.FAILURE, "x", "y"));

        assertDoesNotThrow(result::join);
        verify(storagePort).putText(eq("results"), eq("Job/20260310_080509_FAILED.txt"), anyString());
    }

    private static RunEntry run(String jobName, RunStatus status, String stdout, String stderr) {
        return RunEntry.builder()
                .id(1)
                .jobName(jobName)
                .startTime(STARTED)
                .endTime(STARTED.plusSeconds(3))
                .exitCode(status == RunStatus.SUCCESS ? 0 : 1)
                .status(status)
                .standardOutput(stdout)
                .standardError(stderr)
                .build();
    }
}
