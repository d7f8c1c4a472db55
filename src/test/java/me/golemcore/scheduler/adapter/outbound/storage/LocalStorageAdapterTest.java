package me.golemcore.scheduler.adapter.outbound.storage;

import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String RESULTS = "results";
    private static final String SNAPSHOT = "Digest/20260310_090000_SUCCESS.txt";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        SchedulerProperties properties = new SchedulerProperties();
        properties.getStorage().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void shouldCreateKnownDirectoriesOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("tasks")));
        assertTrue(Files.isDirectory(tempDir.resolve(RESULTS)));
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putText(RESULTS, SNAPSHOT, "Job: Digest").get();

        assertEquals("Job: Digest", storageAdapter.getText(RESULTS, SNAPSHOT).get());
        assertTrue(storageAdapter.exists(RESULTS, SNAPSHOT).get());
    }

    @Test
    void getText_returnsNullForNonExisting() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(RESULTS, "missing.txt").get());
    }

    @Test
    void deleteObject_removesFile() throws ExecutionException, InterruptedException {
        storageAdapter.putText(RESULTS, SNAPSHOT, "content").get();

        storageAdapter.deleteObject(RESULTS, SNAPSHOT).get();

        assertFalse(storageAdapter.exists(RESULTS, SNAPSHOT).get());
        assertDoesNotThrow(() -> storageAdapter.deleteObject(RESULTS, SNAPSHOT).get());
    }

    @Test
    void listObjects_returnsSortedRelativePaths() throws ExecutionException, InterruptedException {
        storageAdapter.putText("tasks", "Other.json", "[]").get();
        storageAdapter.putText("tasks", "GolemCore.json", "[]").get();
        storageAdapter.putText("tasks", "archive/Old.json", "[]").get();

        List<String> files = storageAdapter.listObjects("tasks", "").get();

        assertEquals(List.of("GolemCore.json", "Other.json", "archive/Old.json"), files);
        assertEquals(List.of("archive/Old.json"), storageAdapter.listObjects("tasks", "archive").get());
        assertTrue(storageAdapter.listObjects("absent", null).get().isEmpty());
    }

    @Test
    void ensureDirectory_createsDirectory() throws ExecutionException, InterruptedException {
        storageAdapter.ensureDirectory("exports").get();

        assertTrue(Files.isDirectory(tempDir.resolve("exports")));
    }

    @Test
    void shouldBlockPathTraversal() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.putText(RESULTS, "../../etc/passwd", "hack").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void shouldBlockPathTraversalOnGet() {
        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(RESULTS, "../../../secret").get());
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void putTextAtomic_createsBackupWhenRequested() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("tasks", "GolemCore.json", "[1]", true).get();
        assertFalse(storageAdapter.exists("tasks", "GolemCore.json.bak").get());

        storageAdapter.putTextAtomic("tasks", "GolemCore.json", "[2]", true).get();

        assertEquals("[2]", storageAdapter.getText("tasks", "GolemCore.json").get());
        assertEquals("[1]", storageAdapter.getText("tasks", "GolemCore.json.bak").get());
        assertFalse(storageAdapter.exists("tasks", "GolemCore.json.tmp").get());
    }

    @Test
    void putTextAtomic_noBackupWithoutFlag() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic("tasks", "plain.json", "first", false).get();
        storageAdapter.putTextAtomic("tasks", "plain.json", "second", false).get();

        assertEquals("second", storageAdapter.getText("tasks", "plain.json").get());
        assertFalse(storageAdapter.exists("tasks", "plain.json.bak").get());
    }
}
