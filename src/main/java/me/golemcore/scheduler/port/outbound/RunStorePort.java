package me.golemcore.scheduler.port.outbound;

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

import me.golemcore.scheduler.domain.model.RunEntry;
import me.golemcore.scheduler.domain.model.RunFilter;

import java.util.List;
import java.util.Optional;

/**
 * Durable history of job runs. Listings are ordered by start time descending
 * with the id as tiebreak; {@link #findAfter(long)} is the only ascending
 * query and is meant for incremental consumption.
 *
 * <p>
 * Implementations throw {@link RunStoreException} when the backing engine is
 * unavailable.
 */
public interface RunStorePort {

    /**
     * Append a run and return its assigned id. The id is also set on the
     * entry.
     */
    long insert(RunEntry entry);

    Optional<RunEntry> findById(long id);

    Optional<RunEntry> findByLogFilePath(String logFilePath);

    List<RunEntry> findRecent(int limit, int offset, RunFilter filter);

    int countRecent(RunFilter filter);

    List<RunEntry> findByJob(String jobName);

    int countByJob(String jobName);

    /**
     * Case-insensitive substring match over job name, standard output and
     * prompt.
     */
    List<RunEntry> search(String text, int limit);

    /**
     * Runs with an id greater than {@code id}, in ascending id order.
     */
    List<RunEntry> findAfter(long id);

    boolean deleteById(long id);

    boolean deleteByLogFilePath(String logFilePath);

    int deleteByJob(String jobName);

    int deleteAll();

    /**
     * Delete runs that started more than {@code retentionDays} days ago.
     *
     * @return number of deleted runs
     */
    int purgeOlderThan(int retentionDays);

    /**
     * Highest id ever stored that is still present, or 0 for an empty store.
     */
    long maxId();

    boolean setFavorite(long id, boolean favorite);
}
