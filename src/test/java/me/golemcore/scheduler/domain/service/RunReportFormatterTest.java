package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.model.RunEntry;
import me.golemcore.scheduler.domain.model.RunStatus;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertTrue;

class RunReportFormatterTest {

    @Test
    void shouldRenderAllSections() {
        Instant start = Instant.parse("2026-03-10T08:05:09Z");
        RunReportFormatter formatter = new RunReportFormatter(Clock.fixed(start, ZoneOffset.UTC));
        RunEntry entry = RunEntry.builder()
                .jobName("Digest")
                .prompt("Summarize")
                .command("claude -p \"Summarize\"")
                .startTime(start)
                .endTime(start.plusMillis(2500))
                .exitCode(0)
                .status(RunStatus.SUCCESS)
                .standardOutput("All done")
                .durationSeconds(2.5)
                .build();

        String report = formatter.format(entry);

        assertTrue(report.startsWith("=== Job Run Started: 2026-03-10 08:05:09 ==="));
        assertTrue(report.contains("Job: Digest"));
        assertTrue(report.contains("--- STDOUT ---" + System.lineSeparator() + "All done"));
        assertTrue(report.contains("=== Job Run Completed: 2026-03-10 08:05:11 ==="));
        assertTrue(report.contains("Exit Code: 0"));
        assertTrue(report.contains("Duration: 2.5s"));
        assertTrue(report.contains("Status: SUCCESS"));
    }
}
