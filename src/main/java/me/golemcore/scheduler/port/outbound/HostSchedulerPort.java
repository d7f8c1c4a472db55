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

import me.golemcore.scheduler.domain.model.task.ScheduledTask;
import me.golemcore.scheduler.domain.model.task.TaskDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Port to the host scheduler that owns task execution. Tasks live in named
 * folders; task names are compared case-insensitively within a folder.
 */
public interface HostSchedulerPort {

    /**
     * Whether the scheduler engine is reachable at all.
     */
    boolean isAvailable();

    /**
     * List every task in the folder, creating the folder when missing.
     */
    List<ScheduledTask> listTasks(String folder);

    Optional<ScheduledTask> findTask(String folder, String name);

    /**
     * Create the task or replace an existing one with the same name. A
     * replaced task keeps its enabled flag.
     */
    void registerTask(String folder, String name, TaskDefinition definition);

    /**
     * @throws IllegalArgumentException
     *             when no such task exists
     */
    void deleteTask(String folder, String name);

    /**
     * @throws IllegalArgumentException
     *             when no such task exists
     */
    void setEnabled(String folder, String name, boolean enabled);
}
