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

import me.golemcore.scheduler.domain.model.RunStatus;
import org.jdbi.v3.sqlobject.config.RegisterArgumentFactory;
import org.jdbi.v3.sqlobject.config.RegisterColumnMapper;
import org.jdbi.v3.sqlobject.config.RegisterConstructorMapper;
import org.jdbi.v3.sqlobject.customizer.Bind;
import org.jdbi.v3.sqlobject.statement.SqlQuery;
import org.jdbi.v3.sqlobject.statement.SqlUpdate;

import java.util.List;
import java.util.Optional;

@RegisterColumnMapper(RunStatusColumnMapper.class)
@RegisterArgumentFactory(RunStatusArgumentFactory.class)
@RegisterConstructorMapper(RunRecord.class)
public interface RunEntryDao {

    String NEWEST_FIRST = " ORDER BY StartTime DESC, Id DESC";
    String FILTER = " WHERE (:status IS NULL OR Status = :status) AND (:favoritesOnly = 0 OR IsFavorite = 1)";
    String TEXT_MATCH = " WHERE JobName LIKE :pattern ESCAPE '!' OR StandardOutput LIKE :pattern ESCAPE '!'"
            + " OR Prompt LIKE :pattern ESCAPE '!'";

    @SqlUpdate("INSERT INTO Logs (JobName, StartTime, EndTime, ExitCode, Status, Prompt, Command, "
            + "StandardOutput, StandardError, DurationSeconds, AgentName, LogFilePath, IsFavorite) "
            + "VALUES (:jobName, :startTime, :endTime, :exitCode, :status, :prompt, :command, "
            + ":standardOutput, :standardError, :durationSeconds, :agentName, :logFilePath, :favorite)")
    void insert(@Bind("jobName") String jobName,
                @Bind("startTime") long startTime,
                @Bind("endTime") long endTime,
                @Bind("exitCode") int exitCode,
                @Bind("status") RunStatus status,
                @Bind("prompt") String prompt,
                @Bind("command") String command,
                @Bind("standardOutput") String standardOutput,
                @Bind("standardError") String standardError,
                @Bind("durationSeconds") double durationSeconds,
                @Bind("agentName") String agentName,
                @Bind("logFilePath") String logFilePath,
                @Bind("favorite") boolean favorite);

    @SqlQuery("SELECT last_insert_rowid()")
    long lastInsertId();

    @SqlQuery("SELECT * FROM Logs WHERE Id = :id")
    Optional<RunRecord> findById(@Bind("id") long id);

    @SqlQuery("SELECT * FROM Logs WHERE LogFilePath = :path" + NEWEST_FIRST + " LIMIT 1")
    Optional<RunRecord> findByLogFilePath(@Bind("path") String path);

    @SqlQuery("SELECT * FROM Logs" + FILTER + NEWEST_FIRST + " LIMIT :limit OFFSET :offset")
    List<RunRecord> findRecent(@Bind("limit") int limit,
                               @Bind("offset") int offset,
                               @Bind("status") RunStatus status,
                               @Bind("favoritesOnly") boolean favoritesOnly);

    @SqlQuery("SELECT COUNT(*) FROM Logs" + FILTER)
    int countRecent(@Bind("status") RunStatus status, @Bind("favoritesOnly") boolean favoritesOnly);

    @SqlQuery("SELECT * FROM Logs WHERE JobName = :jobName" + NEWEST_FIRST)
    List<RunRecord> findByJob(@Bind("jobName") String jobName);

    @SqlQuery("SELECT COUNT(*) FROM Logs WHERE JobName = :jobName")
    int countByJob(@Bind("jobName") String jobName);

    @SqlQuery("SELECT * FROM Logs" + TEXT_MATCH + NEWEST_FIRST + " LIMIT :limit")
    List<RunRecord> search(@Bind("pattern") String pattern, @Bind("limit") int limit);

    @SqlQuery("SELECT * FROM Logs WHERE Id > :id ORDER BY Id ASC")
    List<RunRecord> findAfter(@Bind("id") long id);

    @SqlUpdate("DELETE FROM Logs WHERE Id = :id")
    int deleteById(@Bind("id") long id);

    @SqlUpdate("DELETE FROM Logs WHERE LogFilePath = :path")
    int deleteByLogFilePath(@Bind("path") String path);

    @SqlUpdate("DELETE FROM Logs WHERE JobName = :jobName")
    int deleteByJob(@Bind("jobName") String jobName);

    @SqlUpdate("DELETE FROM Logs")
    int deleteAll();

    @SqlUpdate("DELETE FROM Logs WHERE StartTime < :cutoff")
    int deleteStartedBefore(@Bind("cutoff") long cutoff);

    @SqlQuery("SELECT COALESCE(MAX(Id), 0) FROM Logs")
    long maxId();

    @SqlUpdate("UPDATE Logs SET IsFavorite = :favorite WHERE Id = :id")
    int setFavorite(@Bind("id") long id, @Bind("favorite") boolean favorite);
}
