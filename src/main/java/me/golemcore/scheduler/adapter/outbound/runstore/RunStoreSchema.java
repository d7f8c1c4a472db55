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
import org.jdbi.v3.core.Handle;

import java.util.List;

/**
 * Creates the {@code Logs} table and its indexes, and upgrades databases
 * written before runs could be marked as favorites.
 */
@Slf4j
final class RunStoreSchema {

    private static final String CREATE_TABLE = """
            CREATE TABLE IF NOT EXISTS Logs (
                Id INTEGER PRIMARY KEY AUTOINCREMENT,
                JobName TEXT NOT NULL,
                StartTime INTEGER NOT NULL,
                EndTime INTEGER NOT NULL,
                ExitCode INTEGER NOT NULL,
                Status INTEGER NOT NULL,
                Prompt TEXT,
                Command TEXT,
                StandardOutput TEXT,
                StandardError TEXT,
                DurationSeconds REAL NOT NULL,
                AgentName TEXT,
                LogFilePath TEXT,
                IsFavorite INTEGER NOT NULL DEFAULT 0
            )""";

    private static final List<String> INDEXES = List.of(
            "CREATE INDEX IF NOT EXISTS IX_Logs_JobName ON Logs (JobName)",
            "CREATE INDEX IF NOT EXISTS IX_Logs_StartTime ON Logs (StartTime DESC)");

    private RunStoreSchema() {
    }

    static void apply(Handle handle) {
        handle.execute(CREATE_TABLE);
        List<String> columns = handle.createQuery("PRAGMA table_info(Logs)")
                .map((rs, ctx) -> rs.getString("name"))
                .list();
        if (columns.stream().noneMatch("IsFavorite"::equalsIgnoreCase)) {
            log.info("[RunStore] Adding IsFavorite column to existing database");
            handle.execute("ALTER TABLE Logs ADD COLUMN IsFavorite INTEGER NOT NULL DEFAULT 0");
        }
        INDEXES.forEach(handle::execute);
    }
}
