package me.golemcore.scheduler.domain.service;

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

import me.golemcore.scheduler.domain.model.Schedule;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders a schedule as a short English sentence, e.g. {@code Daily at 14:30}
 * or {@code Weekly on Mon, Wed at 09:00}.
 */
@Component
public class ScheduleDescriber {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    public String describe(Schedule schedule) {
        if (schedule == null || schedule.getType() == null) {
            return "Unknown";
        }
        return switch (schedule.getType()) {
        case MINUTE -> "Every " + schedule.getInterval() + " minute(s)";
        case HOURLY -> describeHourly(schedule);
        case DAILY -> "Daily at " + format(schedule.getRunTime());
        case DAILY_RECURRING -> "Every " + schedule.getInterval() + " hour(s) starting at "
                + format(schedule.getStartTime());
        case WEEKLY -> describeWeekly(schedule);
        case MONTHLY_DATES -> describeMonthly(schedule);
        };
    }

    private String describeHourly(Schedule schedule) {
        if (schedule.isTimeRestricted() && schedule.getTimeWindowStart() != null
                && schedule.getTimeWindowEnd() != null) {
            return "Every " + schedule.getInterval() + " hour(s) from " + format(schedule.getTimeWindowStart())
                    + " to " + format(schedule.getTimeWindowEnd());
        }
        return "Every " + schedule.getInterval() + " hour(s)";
    }

    private String describeWeekly(Schedule schedule) {
        List<DayOfWeek> days = schedule.getDaysOfWeek();
        if (days == null || days.isEmpty()) {
            return "Weekly (No days selected) at " + format(schedule.getRunTime());
        }
        String names = days.stream()
                .map(day -> day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH))
                .collect(Collectors.joining(", "));
        return "Weekly on " + names + " at " + format(schedule.getRunTime());
    }

    private String describeMonthly(Schedule schedule) {
        List<Integer> days = schedule.getMonthDays();
        if (days == null || days.isEmpty()) {
            return "Monthly (No days selected) at " + format(schedule.getRunTime());
        }
        String names = days.stream()
                .map(day -> day == Schedule.LAST_DAY_OF_MONTH ? "Last" : String.valueOf(day))
                .collect(Collectors.joining(", "));
        return "Monthly on day(s) " + names + " at " + format(schedule.getRunTime());
    }

    private static String format(LocalTime time) {
        return (time != null ? time : LocalTime.MIDNIGHT).format(TIME_FORMAT);
    }
}
