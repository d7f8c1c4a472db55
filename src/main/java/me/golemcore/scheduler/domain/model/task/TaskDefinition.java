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
import me.golemcore.scheduler.domain.model.trigger.Trigger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything the host scheduler needs to run a task: when, what, and the
 * free-text description that carries the job envelope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskDefinition {

    private String description;

    @Builder.Default
    private List<Trigger> triggers = new ArrayList<>();

    private ExecAction action;

    private Duration executionTimeLimit;

    private boolean startWhenAvailable;
}
