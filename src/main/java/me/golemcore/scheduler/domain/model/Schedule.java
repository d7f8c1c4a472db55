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

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Recurrence rule of a job. One of six fixed shapes selected by
 * {@link ScheduleType}; only the fields relevant to the selected shape are
 * read.
 *
 * <ul>
 * <li>{@code MINUTE} - every {@code interval} minutes</li>
 * <li>{@code HOURLY} - every {@code interval} hours, optionally restricted to
 * weekdays and a time window</li>
 * <li>{@code DAILY} - once a day at {@code runTime}</li>
 * <li>{@code DAILY_RECURRING} - every {@code interval} hours from
 * {@code startTime}, optionally restricted</li>
 * <li>{@code WEEKLY} - on {@code daysOfWeek} at {@code runTime}</li>
 * <li>{@code MONTHLY_DATES} - on {@code monthDays} (1-31, or
 * {@link #LAST_DAY_OF_MONTH}) at {@code runTime}</li>
 * </ul>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Schedule {

    public static final int LAST_DAY_OF_MONTH = 32;
    public static final LocalTime DEFAULT_RUN_TIME = LocalTime.of(9, 0);
    public static final int MAX_MINUTE_INTERVAL = 59;
    public static final int MAX_HOUR_INTERVAL = 12;

    private ScheduleType type;

    @Builder.Default
    private int interval = 1;

    @Builder.Default
    private LocalTime runTime = DEFAULT_RUN_TIME;

    private LocalTime startTime;

    @Builder.Default
    private List<DayOfWeek> daysOfWeek = new ArrayList<>();

    @Builder.Default
    private List<Integer> monthDays = new ArrayList<>();

    private boolean timeRestricted;

    @Builder.Default
    private List<DayOfWeek> restrictedDays = new ArrayList<>();

    private LocalTime timeWindowStart;
    private LocalTime timeWindowEnd;

    public enum ScheduleType {
        MINUTE, HOURLY, DAILY, DAILY_RECURRING, WEEKLY, MONTHLY_DATES
    }

    /**
     * Restriction applies only when it names at least one weekday.
     */
    @JsonIgnore
    public boolean isRestrictedToDays() {
        return timeRestricted && restrictedDays != null && !restrictedDays.isEmpty();
    }

    public void validate() {
        if (type == null) {
            throw new IllegalArgumentException("Schedule type is required");
        }
        if (interval < 1) {
            throw new IllegalArgumentException("Schedule interval must be at least 1, got " + interval);
        }
        int maxInterval = maxInterval(type);
        if (interval > maxInterval) {
            throw new IllegalArgumentException(
                    "Schedule interval for " + type + " must be at most " + maxInterval + ", got " + interval);
        }
        boolean usesRunTime = type == ScheduleType.DAILY || type == ScheduleType.WEEKLY
                || type == ScheduleType.MONTHLY_DATES;
        if (usesRunTime && runTime == null) {
            throw new IllegalArgumentException("Schedule run time is required for " + type);
        }
        if (monthDays != null) {
            for (Integer day : monthDays) {
                if (day == null || day < 1 || day > LAST_DAY_OF_MONTH) {
                    throw new IllegalArgumentException("Invalid day of month: " + day);
                }
            }
        }
    }

    // A 60-minute repetition reads back as hourly, so minute intervals stop at 59.
    private static int maxInterval(ScheduleType type) {
        return switch (type) {
        case MINUTE -> MAX_MINUTE_INTERVAL;
        case HOURLY, DAILY_RECURRING -> MAX_HOUR_INTERVAL;
        default -> Integer.MAX_VALUE;
        };
    }

    public static Schedule minutes(int interval) {
        return Schedule.builder().type(ScheduleType.MINUTE).interval(interval).build();
    }

    public static Schedule hourly(int interval) {
        return Schedule.builder().type(ScheduleType.HOURLY).interval(interval).build();
    }

    public static Schedule daily(LocalTime runTime) {
        return Schedule.builder().type(ScheduleType.DAILY).runTime(runTime).build();
    }

    public static Schedule dailyRecurring(int interval, LocalTime startTime) {
        return Schedule.builder().type(ScheduleType.DAILY_RECURRING).interval(interval).startTime(startTime).build();
    }

    public static Schedule weekly(List<DayOfWeek> days, LocalTime runTime) {
        return Schedule.builder().type(ScheduleType.WEEKLY).daysOfWeek(new ArrayList<>(days)).runTime(runTime)
                .build();
    }

    public static Schedule monthly(List<Integer> days, LocalTime runTime) {
        return Schedule.builder().type(ScheduleType.MONTHLY_DATES).monthDays(new ArrayList<>(days)).runTime(runTime)
                .build();
    }
}
