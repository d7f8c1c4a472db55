package me.golemcore.scheduler.adapter.inbound.cli;

import me.golemcore.scheduler.adapter.outbound.runstore.SqliteRunStoreAdapter;
import me.golemcore.scheduler.domain.model.RunEntry;
import me.golemcore.scheduler.domain.model.RunFilter;
import me.golemcore.scheduler.domain.model.RunStatus;
import me.golemcore.scheduler.domain.service.AgentCommandService;
import me.golemcore.scheduler.domain.service.JobRunner;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunJobCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldReturnUsageErrorForIncompleteArguments() {
        assertEquals(RunJobCommand.USAGE_ERROR, RunJobCommand.run(new String[] { "--run-job" }));
        assertEquals(RunJobCommand.USAGE_ERROR, RunJobCommand.run(new String[] { "--run-job", "Digest" }));
        assertEquals(RunJobCommand.USAGE_ERROR,
                RunJobCommand.run(new String[] { "--run-job", "Digest", "not base64!", "x", "logs" }));
    }

    @Test
    void shouldRecordFailedLaunchInRunStore() {
        String[] args = {
                "--run-job", "Digest",
                "--command", "no-such-agent-xyz -p {prompt}",
                "--prompt", "Summarize",
                "--logs", tempDir.toString()
        };

        int exitCode = RunJobCommand.run(args);

        assertEquals(-1, exitCode);
        List<RunEntry> runs = new SqliteRunStoreAdapter(tempDir, Clock.systemUTC()).findRecent(10, 0,
                RunFilter.NONE);
        assertEquals(1, runs.size());
        RunEntry run = runs.get(0);
        assertEquals("Digest", run.getJobName());
        assertEquals(RunStatus.FAILURE, run.getStatus());
        assertEquals("no-such-agent-xyz -p Summarize", run.getCommand());
        assertTrue(run.getStandardError().startsWith("Failed to execute command:"));
    }

    @Test
    void shouldRecordRunWhenPromptFlagIsEmpty() {
        String[] args = {
                "--run-job", "Digest",
                "--command", "no-such-agent-xyz",
                "--prompt", "",
                "--logs", tempDir.toString()
        };

        RunJobCommand.run(args);

        List<RunEntry> runs = new SqliteRunStoreAdapter(tempDir, Clock.systemUTC()).findRecent(10, 0,
                RunFilter.NONE);
        assertEquals(1, runs.size());
        assertEquals("no-such-agent-xyz", runs.get(0).getCommand());
    }

    @Test
    void shouldLimitDetachedRunsToTenMinutes() {
        assertEquals(Duration.ofMinutes(10), JobRunner.DETACHED_RUN_TIMEOUT);
        assertEquals("Error: Command timed out after 10 minutes.",
                AgentCommandService.timeoutMessage(JobRunner.DETACHED_RUN_TIMEOUT));
    }
}
