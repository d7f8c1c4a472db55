package me.golemcore.scheduler.domain.model.task;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A task registered with the host scheduler, as reported back by it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledTask {

    private String name;
    private TaskDefinition definition;

    @Builder.Default
    private boolean enabled = true;

    private Instant lastRunTime;
    private Instant nextRunTime;

    @Builder.Default
    private TaskState state = TaskState.READY;

    public enum TaskState {
        READY, RUNNING, DISABLED
    }
}
