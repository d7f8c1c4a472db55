package me.golemcore.scheduler.adapter.outbound.runstore;

import me.golemcore.scheduler.domain.model.RunEntry;
import me.golemcore.scheduler.domain.model.RunFilter;
import me.golemcore.scheduler.domain.model.RunStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteRunStoreAdapterTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @TempDir
    Path tempDir;

    private SqliteRunStoreAdapter store;

    @BeforeEach
    void setUp() {
        store = new SqliteRunStoreAdapter(tempDir.resolve("runs"), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void shouldCreateDatabaseFile() {
        assertTrue(Files.exists(tempDir.resolve("runs").resolve(SqliteRunStoreAdapter.DATABASE_FILE)));
        assertEquals(0, store.maxId());
    }

    @Test
    void shouldAssignIncreasingIdsAndReadBackAllFields() {
        RunEntry first = run("Digest", NOW.minusSeconds(60), 0, "headline");
        first.setStandardError("warning");
        first.setAgentName("Claude Code");
        first.setLogFilePath("/logs/digest.txt");

        long firstId = store.insert(first);
        long secondId = store.insert(run("Digest", NOW, 2, "oops"));

        assertTrue(secondId > firstId);
        assertEquals(firstId, first.getId());
        assertEquals(secondId, store.maxId());
        RunEntry read = store.findById(firstId).orElseThrow();
        assertEquals("Digest", read.getJobName());
        assertEquals(NOW.minusSeconds(60), read.getStartTime());
        assertEquals(NOW.minusSeconds(30), read.getEndTime());
        assertEquals(RunStatus.SUCCESS, read.getStatus());
        assertEquals("headline", read.getStandardOutput());
        assertEquals("warning", read.getStandardError());
        assertEquals(30.0, read.getDurationSeconds(), 0.0001);
        assertEquals("Claude Code", read.getAgentName());
        assertEquals("/logs/digest.txt", read.getLogFilePath());
        assertFalse(read.isFavorite());
        assertEquals(RunStatus.FAILURE, store.findById(secondId).orElseThrow().getStatus());
        assertEquals(firstId, store.findByLogFilePath("/logs/digest.txt").orElseThrow().getId());
    }

    @Test
    void shouldOrderNewestFirstWithIdBreakingTies() {
        long older = store.insert(run("A", NOW.minusSeconds(600), 0, "a"));
        long tieLow = store.insert(run("B", NOW, 0, "b"));
        long tieHigh = store.insert(run("C", NOW, 0, "c"));

        List<RunEntry> recent = store.findRecent(10, 0, RunFilter.NONE);

        assertEquals(List.of(tieHigh, tieLow, older), recent.stream().map(RunEntry::getId).toList());
        assertEquals(List.of(tieLow), store.findRecent(1, 1, null).stream().map(RunEntry::getId).toList());
        assertEquals(3, store.countRecent(RunFilter.NONE));
    }

    @Test
    void shouldFilterByStatusAndFavorites() {
        long ok = store.insert(run("A", NOW.minusSeconds(20), 0, "a"));
        long failed = store.insert(run("A", NOW.minusSeconds(10), 1, "b"));
        store.insert(run("B", NOW, 0, "c"));
        assertTrue(store.setFavorite(ok, true));

        List<RunEntry> failures = store.findRecent(10, 0, new RunFilter(RunStatus.FAILURE, false));
        List<RunEntry> favorites = store.findRecent(10, 0, new RunFilter(null, true));

        assertEquals(List.of(failed), failures.stream().map(RunEntry::getId).toList());
        assertEquals(List.of(ok), favorites.stream().map(RunEntry::getId).toList());
        assertEquals(2, store.countRecent(new RunFilter(RunStatus.SUCCESS, false)));
        assertEquals(1, store.countRecent(new RunFilter(RunStatus.SUCCESS, true)));
        assertFalse(store.setFavorite(999, true));
    }

    @Test
    void shouldListRunsOfOneJob() {
        store.insert(run("Digest", NOW.minusSeconds(10), 0, "a"));
        store.insert(run("Other", NOW.minusSeconds(5), 0, "b"));
        store.insert(run("Digest", NOW, 0, "c"));

        List<RunEntry> runs = store.findByJob("Digest");

        assertEquals(2, runs.size());
        assertEquals("c", runs.get(0).getStandardOutput());
        assertEquals(2, store.countByJob("Digest"));
        assertEquals(0, store.countByJob("Missing"));
    }

    @Test
    void shouldSearchJobNameOutputAndPromptIgnoringCase() {
        store.insert(run("Weekly Report", NOW.minusSeconds(30), 0, "nothing"));
        store.insert(run("Digest", NOW.minusSeconds(20), 0, "The REPORT is ready"));
        RunEntry byPrompt = run("Cleanup", NOW.minusSeconds(10), 0, "done");
        byPrompt.setPrompt("write a report");
        store.insert(byPrompt);
        store.insert(run("Unrelated", NOW, 0, "nope"));

        List<RunEntry> matches = store.search("report", 10);

        assertEquals(List.of("Cleanup", "Digest", "Weekly Report"),
                matches.stream().map(RunEntry::getJobName).toList());
        assertEquals(1, store.search("report", 1).size());
    }

    @Test
    void shouldTreatLikeWildcardsLiterally() {
        store.insert(run("Percent", NOW.minusSeconds(10), 0, "100% done"));
        store.insert(run("Plain", NOW, 0, "1000 done"));

        List<RunEntry> matches = store.search("0% d", 10);

        assertEquals(List.of("Percent"), matches.stream().map(RunEntry::getJobName).toList());
        assertTrue(store.search("_", 10).isEmpty());
    }

    @Test
    void shouldEscapeLikeMetacharacters() {
        assertEquals("a!%b!_c!!d", SqliteRunStoreAdapter.escapeLike("a%b_c!d"));
    }

    @Test
    void shouldReturnRunsAfterIdInAscendingOrder() {
        long first = store.insert(run("A", NOW, 0, "a"));
        long second = store.insert(run("B", NOW.minusSeconds(100), 0, "b"));
        long third = store.insert(run("C", NOW.minusSeconds(50), 0, "c"));

        List<RunEntry> after = store.findAfter(first);

        assertEquals(List.of(second, third), after.stream().map(RunEntry::getId).toList());
        assertTrue(store.findAfter(third).isEmpty());
    }

    @Test
    void shouldDeleteRuns() {
        long first = store.insert(run("A", NOW, 0, "a"));
        RunEntry withLog = run("B", NOW, 0, "b");
        withLog.setLogFilePath("/logs/b.txt");
        store.insert(withLog);
        store.insert(run("C", NOW, 0, "c"));
        store.insert(run("C", NOW, 0, "c"));

        assertTrue(store.deleteById(first));
        assertFalse(store.deleteById(first));
        assertTrue(store.deleteByLogFilePath("/logs/b.txt"));
        assertEquals(2, store.deleteByJob("C"));
        assertEquals(0, store.deleteAll());
    }

    @Test
    void shouldPurgeRunsOlderThanRetention() {
        store.insert(run("Old", NOW.minus(31, ChronoUnit.DAYS), 0, "old"));
        store.insert(run("Recent", NOW.minus(29, ChronoUnit.DAYS), 0, "recent"));
        store.insert(run("Today", NOW, 0, "today"));

        assertEquals(1, store.purgeOlderThan(30));

        assertEquals(List.of("Today", "Recent"),
                store.findRecent(10, 0, RunFilter.NONE).stream().map(RunEntry::getJobName).toList());
    }

    @Test
    void shouldSeeRowsWrittenByAnotherConnection() {
        SqliteRunStoreAdapter runner = new SqliteRunStoreAdapter(tempDir.resolve("runs"), Clock.systemUTC());

        long id = runner.insert(run("Digest", NOW, 0, "from runner"));

        assertEquals(id, store.maxId());
        assertEquals("from runner", store.findById(id).orElseThrow().getStandardOutput());
    }

    private static RunEntry run(String jobName, Instant start, int exitCode, String output) {
        return RunEntry.builder()
                .jobName(jobName)
                .startTime(start)
                .endTime(start.plusSeconds(30))
                .exitCode(exitCode)
                .prompt("prompt")
                .command("claude -p prompt")
                .standardOutput(output)
                .durationSeconds(30)
                .build();
    }
}
