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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One recorded job execution. Immutable once stored apart from the favorite
 * flag. The id is assigned by the run store and grows with insertion order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunEntry {

    private long id;
    private String jobName;
    private Instant startTime;
    private Instant endTime;
    private int exitCode;
    private RunStatus status;
    private String prompt;
    private String command;
    private String standardOutput;
    private String standardError;
    private double durationSeconds;
    private String agentName;
    private String logFilePath;
    private boolean favorite;

    @JsonIgnore
    public boolean isSuccess() {
        return status == RunStatus.SUCCESS;
    }
}
