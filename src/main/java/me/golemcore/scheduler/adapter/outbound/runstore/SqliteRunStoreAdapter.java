package me.golemcore.scheduler.adapter.outbound.runstore;

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
import me.golemcore.scheduler.domain.model.RunFilter;
import me.golemcore.scheduler.domain.model.RunStatus;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.RunStorePort;
import me.golemcore.scheduler.port.outbound.RunStoreException;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.JdbiException;
import org.jdbi.v3.core.extension.ExtensionCallback;
import org.jdbi.v3.core.statement.Slf4JSqlLogger;
import org.jdbi.v3.sqlobject.SqlObjectPlugin;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * SQLite implementation of {@link RunStorePort}.
 *
 * <p>
 * The database runs in WAL mode so that the application can read while
 * detached job runners append rows from other processes. Lock contention is
 * absorbed by a busy timeout rather than by application-level locking.
 * Timestamps are stored as epoch milliseconds.
 */
@Component
@Slf4j
public class SqliteRunStoreAdapter implements RunStorePort {

    public static final String DATABASE_FILE = "runs.db";

    private static final int BUSY_TIMEOUT_MILLIS = 5000;
    private static final char LIKE_ESCAPE = '!';

    private final Path databaseFile;
    private final Clock clock;
    private final Jdbi jdbi;

    @Autowired
    public SqliteRunStoreAdapter(SchedulerProperties properties, Clock clock) {
        this(properties.getRuns().resolveDirectory(), clock);
    }

    public SqliteRunStoreAdapter(Path directory, Clock clock) {
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create run store directory: " + directory, e);
        }
        this.databaseFile = directory.resolve(DATABASE_FILE).toAbsolutePath();
        this.jdbi = Jdbi.create(createDataSource(databaseFile))
                .installPlugin(new SqlObjectPlugin())
                .setSqlLogger(new Slf4JSqlLogger());
        try {
            jdbi.useHandle(RunStoreSchema::apply);
        } catch (JdbiException e) {
            throw new RunStoreException("Failed to initialize run store at " + databaseFile, e);
        }
        log.debug("[RunStore] Opened {}", databaseFile);
    }

    public Path getDatabaseFile() {
        return databaseFile;
    }

    @Override
    public long insert(RunEntry entry) {
        RunStatus status = entry.getStatus() != null ? entry.getStatus() : RunStatus.fromExitCode(entry.getExitCode());
        // last_insert_rowid() is per connection; both statements share the extension's handle
        long id = withDao(dao -> {
            dao.insert(entry.getJobName(),
                    toMillis(entry.getStartTime()),
                    toMillis(entry.getEndTime()),
                    entry.getExitCode(),
                    status,
                    entry.getPrompt(),
                    entry.getCommand(),
                    entry.getStandardOutput(),
                    entry.getStandardError(),
                    entry.getDurationSeconds(),
                    entry.getAgentName(),
                    entry.getLogFilePath(),
                    entry.isFavorite());
            return dao.lastInsertId();
        });
        entry.setId(id);
        entry.setStatus(status);
        return id;
    }

    @Override
    public Optional<RunEntry> findById(long id) {
        return withDao(dao -> dao.findById(id)).map(SqliteRunStoreAdapter::toEntry);
    }

    @Override
    public Optional<RunEntry> findByLogFilePath(String logFilePath) {
        return withDao(dao -> dao.findByLogFilePath(logFilePath)).map(SqliteRunStoreAdapter::toEntry);
    }

    @Override
    public List<RunEntry> findRecent(int limit, int offset, RunFilter filter) {
        RunFilter effective = filter != null ? filter : RunFilter.NONE;
        return toEntries(withDao(dao -> dao.findRecent(limit, Math.max(0, offset), effective.status(),
                effective.favoritesOnly())));
    }

    @Override
    public int countRecent(RunFilter filter) {
        RunFilter effective = filter != null ? filter : RunFilter.NONE;
        return withDao(dao -> dao.countRecent(effective.status(), effective.favoritesOnly()));
    }

    @Override
    public List<RunEntry> findByJob(String jobName) {
        return toEntries(withDao(dao -> dao.findByJob(jobName)));
    }

    @Override
    public int countByJob(String jobName) {
        return withDao(dao -> dao.countByJob(jobName));
    }

    @Override
    public List<RunEntry> search(String text, int limit) {
        String pattern = "%" + escapeLike(text != null ? text : "") + "%";
        return toEntries(withDao(dao -> dao.search(pattern, limit)));
    }

    @Override
    public List<RunEntry> findAfter(long id) {
        return toEntries(withDao(dao -> dao.findAfter(id)));
    }

    @Override
    public boolean deleteById(long id) {
        return withDao(dao -> dao.deleteById(id)) > 0;
    }

    @Override
    public boolean deleteByLogFilePath(String logFilePath) {
        return withDao(dao -> dao.deleteByLogFilePath(logFilePath)) > 0;
    }

    @Override
    public int deleteByJob(String jobName) {
        return withDao(dao -> dao.deleteByJob(jobName));
    }

    @Override
    public int deleteAll() {
        return withDao(RunEntryDao::deleteAll);
    }

    @Override
    public int purgeOlderThan(int retentionDays) {
        long cutoff = Instant.now(clock).minus(Duration.ofDays(retentionDays)).toEpochMilli();
        int deleted = withDao(dao -> dao.deleteStartedBefore(cutoff));
        if (deleted > 0) {
            log.info("[RunStore] Purged {} run(s) older than {} day(s)", deleted, retentionDays);
        }
        return deleted;
    }

    @Override
    public long maxId() {
        return withDao(RunEntryDao::maxId);
    }

    @Override
    public boolean setFavorite(long id, boolean favorite) {
        return withDao(dao -> dao.setFavorite(id, favorite)) > 0;
    }

    private <R> R withDao(ExtensionCallback<R, RunEntryDao, RuntimeException> callback) {
        try {
            return jdbi.withExtension(RunEntryDao.class, callback);
        } catch (JdbiException e) {
            throw new RunStoreException("Run store operation failed: " + e.getMessage(), e);
        }
    }

    private static SQLiteDataSource createDataSource(Path file) {
        SQLiteConfig config = new SQLiteConfig();
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        config.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        config.setBusyTimeout(BUSY_TIMEOUT_MILLIS);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + file);
        return dataSource;
    }

    static String escapeLike(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    private static long toMillis(Instant instant) {
        return instant != null ? instant.toEpochMilli() : 0L;
    }

    private static List<RunEntry> toEntries(List<RunRecord> records) {
        return records.stream().map(SqliteRunStoreAdapter::toEntry).toList();
    }

    private static RunEntry toEntry(RunRecord record) {
        return RunEntry.builder()
                .id(record.id())
                .jobName(record.jobName())
                .startTime(Instant.ofEpochMilli(record.startTime()))
                .endTime(Instant.ofEpochMilli(record.endTime()))
                .exitCode(record.exitCode())
                .status(record.status())
                .prompt(record.prompt())
                .command(record.command())
                .standardOutput(record.standardOutput())
                .standardError(record.standardError())
                .durationSeconds(record.durationSeconds())
                .agentName(record.agentName())
                .logFilePath(record.logFilePath())
                .favorite(record.favorite())
                .build();
    }
}
