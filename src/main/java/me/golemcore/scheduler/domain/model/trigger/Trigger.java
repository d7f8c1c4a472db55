package me.golemcore.scheduler.domain.model.trigger;

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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.LocalDateTime;

/**
 * Recurrence primitive understood by the host scheduler. Every trigger has a
 * start boundary; occurrences before it never fire.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DailyTrigger.class, name = "daily"),
        @JsonSubTypes.Type(value = WeeklyTrigger.class, name = "weekly"),
        @JsonSubTypes.Type(value = MonthlyTrigger.class, name = "monthly"),
        @JsonSubTypes.Type(value = MonthlyLastWeekTrigger.class, name = "monthlyLastWeek")
})
public interface Trigger {

    LocalDateTime startBoundary();

    default Repetition repetition() {
        return Repetition.NONE;
    }
}
