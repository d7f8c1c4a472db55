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
import org.jdbi.v3.core.mapper.reflect.ColumnName;

public record RunRecord(
        @ColumnName("Id") long id,
        @ColumnName("JobName") String jobName,
        @ColumnName("StartTime") long startTime,
        @ColumnName("EndTime") long endTime,
        @ColumnName("ExitCode") int exitCode,
        @ColumnName("Status") RunStatus status,
        @ColumnName("Prompt") String prompt,
        @ColumnName("Command") String command,
        @ColumnName("StandardOutput") String standardOutput,
        @ColumnName("StandardError") String standardError,
        @ColumnName("DurationSeconds") double durationSeconds,
        @ColumnName("AgentName") String agentName,
        @ColumnName("LogFilePath") String logFilePath,
        @ColumnName("IsFavorite") boolean favorite
) {}
