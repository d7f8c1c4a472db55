package me.golemcore.scheduler.domain.model;

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
 * A recurring prompt sent to a command-line agent. Identity is the name,
 * compared case-insensitively within the task folder. The last run, next run
 * and running fields are read from the host scheduler and never written back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Job {

    private String name;
    private String prompt;
    private Schedule schedule;
    private boolean silent;

    @Builder.Default
    private boolean enabled = true;

    private String agentOverride;
    private String hexColor;
    private String icon;

    private Instant lastRunTime;
    private Instant nextRunTime;
    private boolean running;

    public boolean hasName(String other) {
        return name != null && other != null && name.equalsIgnoreCase(other);
    }
}
