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
import me.golemcore.scheduler.domain.model.Schedule.ScheduleType;
import me.golemcore.scheduler.domain.model.trigger.DailyTrigger;
import me.golemcore.scheduler.domain.model.trigger.MonthlyLastWeekTrigger;
import me.golemcore.scheduler.domain.model.trigger.MonthlyTrigger;
import me.golemcore.scheduler.domain.model.trigger.Repetition;
import me.golemcore.scheduler.domain.model.trigger.Trigger;
import me.golemcore.scheduler.domain.model.trigger.WeeklyTrigger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Translates between {@link Schedule} and host scheduler triggers.
 *
 * <p>
 * The forward direction is exact. The reverse direction is best effort: it
 * reads only the first trigger, and several shapes collapse into the same
 * schedule. An unrestricted daily-recurring schedule comes back as hourly,
 * both restricted hourly and restricted daily-recurring come back as
 * restricted hourly, and a monthly schedule with numbered days and the last
 * day comes back with the numbered days only. Translating the result forward
 * and back again is stable.
 *
 * <p>
 * Weekly and monthly schedules with no selected days produce no triggers and
 * so never run.
 */
@Service
public class TriggerTranslator {

    private static final Duration FULL_DAY = Duration.ofHours(24);
    private static final int MINUTES_PER_HOUR = 60;

    private final Clock clock;

    public TriggerTranslator(Clock clock) {
        this.clock = clock;
    }

    public List<Trigger> toTriggers(Schedule schedule) {
        schedule.validate();
        List<Trigger> triggers = new ArrayList<>();
        switch (schedule.getType()) {
        case MINUTE -> triggers.add(DailyTrigger.repeating(today().atStartOfDay(),
                Repetition.every(Duration.ofMinutes(schedule.getInterval()), FULL_DAY)));
        case HOURLY -> triggers.add(hourlyTrigger(schedule));
        case DAILY -> triggers.add(DailyTrigger.at(today().atTime(schedule.getRunTime())));
        case DAILY_RECURRING -> triggers.add(dailyRecurringTrigger(schedule));
        case WEEKLY -> addWeeklyTrigger(triggers, schedule);
        case MONTHLY_DATES -> addMonthlyTriggers(triggers, schedule);
        default -> throw new IllegalArgumentException("Unsupported schedule type: " + schedule.getType());
        }
        return triggers;
    }

    public Schedule fromTriggers(List<Trigger> triggers) {
        Schedule schedule = Schedule.builder().type(ScheduleType.DAILY).build();
        if (triggers == null || triggers.isEmpty()) {
            return schedule;
        }

        Trigger trigger = triggers.get(0);
        if (trigger instanceof DailyTrigger daily) {
            readDaily(schedule, daily);
        } else if (trigger instanceof WeeklyTrigger weekly) {
            readWeekly(schedule, weekly);
        } else if (trigger instanceof MonthlyTrigger monthly) {
            schedule.setType(ScheduleType.MONTHLY_DATES);
            schedule.setMonthDays(new ArrayList<>(monthly.daysOfMonth()));
            schedule.setRunTime(monthly.startBoundary().toLocalTime());
        } else if (trigger instanceof MonthlyLastWeekTrigger lastWeek) {
            schedule.setType(ScheduleType.MONTHLY_DATES);
            schedule.setMonthDays(new ArrayList<>(List.of(Schedule.LAST_DAY_OF_MONTH)));
            schedule.setRunTime(lastWeek.startBoundary().toLocalTime());
        }
        return schedule;
    }

    private Trigger hourlyTrigger(Schedule schedule) {
        Duration interval = Duration.ofHours(schedule.getInterval());
        if (!schedule.isRestrictedToDays()) {
            return DailyTrigger.repeating(today().atStartOfDay(), Repetition.every(interval, FULL_DAY));
        }
        LocalTime anchor = orMidnight(schedule.getTimeWindowStart());
        Duration duration = windowDuration(anchor, schedule);
        return new WeeklyTrigger(today().atTime(anchor), EnumSet.copyOf(schedule.getRestrictedDays()),
                Repetition.every(interval, duration));
    }

    private Trigger dailyRecurringTrigger(Schedule schedule) {
        Duration interval = Duration.ofHours(schedule.getInterval());
        LocalTime anchor = orMidnight(schedule.getStartTime());
        if (!schedule.isRestrictedToDays()) {
            return DailyTrigger.repeating(today().atTime(anchor), Repetition.every(interval, FULL_DAY));
        }
        Duration duration = windowDuration(anchor, schedule);
        return new WeeklyTrigger(today().atTime(anchor), EnumSet.copyOf(schedule.getRestrictedDays()),
                Repetition.every(interval, duration));
    }

    /**
     * Length of the repetition window measured from the anchor. A window that
     * is missing a bound, or that does not end after the anchor, spans a full
     * day.
     */
    private Duration windowDuration(LocalTime anchor, Schedule schedule) {
        if (schedule.getTimeWindowStart() == null || schedule.getTimeWindowEnd() == null) {
            return FULL_DAY;
        }
        Duration duration = Duration.between(anchor, schedule.getTimeWindowEnd());
        return duration.isNegative() || duration.isZero() ? FULL_DAY : duration;
    }

    private void addWeeklyTrigger(List<Trigger> triggers, Schedule schedule) {
        if (schedule.getDaysOfWeek() == null || schedule.getDaysOfWeek().isEmpty()) {
            return;
        }
        triggers.add(new WeeklyTrigger(today().atTime(schedule.getRunTime()), EnumSet.copyOf(schedule.getDaysOfWeek()),
                Repetition.NONE));
    }

    private void addMonthlyTriggers(List<Trigger> triggers, Schedule schedule) {
        List<Integer> days = schedule.getMonthDays();
        if (days == null || days.isEmpty()) {
            return;
        }
        LocalDateTime start = today().atTime(schedule.getRunTime());
        List<Integer> numbered = days.stream().filter(day -> day >= 1 && day <= 31).toList();
        if (!numbered.isEmpty()) {
            triggers.add(new MonthlyTrigger(start, numbered));
        }
        if (days.contains(Schedule.LAST_DAY_OF_MONTH)) {
            triggers.add(MonthlyLastWeekTrigger.lastDayOfMonth(start));
        }
    }

    private void readDaily(Schedule schedule, DailyTrigger trigger) {
        Repetition repetition = trigger.repetition();
        if (!repetition.repeats()) {
            schedule.setType(ScheduleType.DAILY);
            schedule.setRunTime(trigger.startBoundary().toLocalTime());
            return;
        }
        long minutes = repetition.interval().toMinutes();
        if (minutes < MINUTES_PER_HOUR) {
            schedule.setType(ScheduleType.MINUTE);
            schedule.setInterval((int) Math.max(1, minutes));
        } else {
            schedule.setType(ScheduleType.HOURLY);
            schedule.setInterval((int) repetition.interval().toHours());
        }
    }

    private void readWeekly(Schedule schedule, WeeklyTrigger trigger) {
        Repetition repetition = trigger.repetition();
        if (!repetition.repeats()) {
            schedule.setType(ScheduleType.WEEKLY);
            schedule.setDaysOfWeek(sortedDays(trigger.daysOfWeek()));
            schedule.setRunTime(trigger.startBoundary().toLocalTime());
            return;
        }
        LocalTime windowStart = trigger.startBoundary().toLocalTime();
        schedule.setType(ScheduleType.HOURLY);
        schedule.setInterval((int) Math.max(1, repetition.interval().toHours()));
        schedule.setTimeRestricted(true);
        schedule.setRestrictedDays(sortedDays(trigger.daysOfWeek()));
        schedule.setTimeWindowStart(windowStart);
        Duration duration = repetition.duration();
        if (duration.compareTo(Duration.ZERO) > 0 && duration.compareTo(FULL_DAY) < 0) {
            schedule.setTimeWindowEnd(windowStart.plus(duration));
        }
    }

    private static List<DayOfWeek> sortedDays(Set<DayOfWeek> days) {
        if (days.isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(EnumSet.copyOf(days));
    }

    private static LocalTime orMidnight(LocalTime time) {
        return time != null ? time : LocalTime.MIDNIGHT;
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
