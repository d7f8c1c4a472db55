package me.golemcore.scheduler.adapter.outbound.scheduler;

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

import me.golemcore.scheduler.domain.model.trigger.DailyTrigger;
import me.golemcore.scheduler.domain.model.trigger.MonthlyLastWeekTrigger;
import me.golemcore.scheduler.domain.model.trigger.MonthlyTrigger;
import me.golemcore.scheduler.domain.model.trigger.Repetition;
import me.golemcore.scheduler.domain.model.trigger.Trigger;
import me.golemcore.scheduler.domain.model.trigger.WeeklyTrigger;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Computes when triggers fire next.
 *
 * <p>
 * A trigger activates once per matching day at the time of its start
 * boundary. A repeating trigger then fires every interval for as long as its
 * duration lasts, but never a full day or more after the activation. A zero
 * duration repeats for the whole day.
 */
public final class TriggerOccurrences {

    private static final Duration FULL_DAY = Duration.ofHours(24);
    private static final int SEARCH_DAYS = 400;

    private TriggerOccurrences() {
    }

    /**
     * Earliest occurrence of any trigger strictly after {@code after}.
     */
    public static Optional<LocalDateTime> next(List<Trigger> triggers, LocalDateTime after) {
        if (triggers == null) {
            return Optional.empty();
        }
        Optional<LocalDateTime> earliest = Optional.empty();
        for (Trigger trigger : triggers) {
            Optional<LocalDateTime> candidate = next(trigger, after);
            if (candidate.isPresent() && (earliest.isEmpty() || candidate.get().isBefore(earliest.get()))) {
                earliest = candidate;
            }
        }
        return earliest;
    }

    public static Optional<LocalDateTime> next(Trigger trigger, LocalDateTime after) {
        LocalDateTime start = trigger.startBoundary();
        LocalTime anchor = start.toLocalTime();
        LocalDate startDate = start.toLocalDate();
        // Repetitions of the previous day's activation may still be pending.
        LocalDate day = after.toLocalDate().minusDays(1);
        if (day.isBefore(startDate)) {
            day = startDate;
        }

        LocalDateTime best = null;
        for (int i = 0; i < SEARCH_DAYS; i++, day = day.plusDays(1)) {
            LocalDateTime activation = day.atTime(anchor);
            if (best != null && activation.isAfter(best)) {
                break;
            }
            if (!activatesOn(trigger, day)) {
                continue;
            }
            LocalDateTime candidate = firstAfter(activation, trigger.repetition(), after);
            if (candidate != null && (best == null || candidate.isBefore(best))) {
                best = candidate;
            }
        }
        return Optional.ofNullable(best);
    }

    static boolean activatesOn(Trigger trigger, LocalDate day) {
        LocalDate startDate = trigger.startBoundary().toLocalDate();
        if (day.isBefore(startDate)) {
            return false;
        }
        if (trigger instanceof DailyTrigger daily) {
            return ChronoUnit.DAYS.between(startDate, day) % daily.daysInterval() == 0;
        }
        if (trigger instanceof WeeklyTrigger weekly) {
            return weekly.daysOfWeek().contains(day.getDayOfWeek());
        }
        if (trigger instanceof MonthlyTrigger monthly) {
            return monthly.daysOfMonth().contains(day.getDayOfMonth());
        }
        if (trigger instanceof MonthlyLastWeekTrigger lastWeek) {
            return isLastSelectedDayOfMonth(lastWeek, day);
        }
        return false;
    }

    private static boolean isLastSelectedDayOfMonth(MonthlyLastWeekTrigger trigger, LocalDate day) {
        if (!trigger.daysOfWeek().contains(day.getDayOfWeek())) {
            return false;
        }
        int lastDay = day.lengthOfMonth();
        if (day.getDayOfMonth() <= lastDay - 7) {
            return false;
        }
        for (int later = day.getDayOfMonth() + 1; later <= lastDay; later++) {
            if (trigger.daysOfWeek().contains(day.withDayOfMonth(later).getDayOfWeek())) {
                return false;
            }
        }
        return true;
    }

    private static LocalDateTime firstAfter(LocalDateTime activation, Repetition repetition, LocalDateTime after) {
        if (activation.isAfter(after)) {
            return activation;
        }
        if (!repetition.repeats()) {
            return null;
        }
        Duration window = repetition.duration().isZero() || repetition.duration().compareTo(FULL_DAY) > 0
                ? FULL_DAY
                : repetition.duration();
        long intervalNanos = repetition.interval().toNanos();
        long elapsed = Duration.between(activation, after).toNanos();
        Duration offset = Duration.ofNanos((elapsed / intervalNanos + 1) * intervalNanos);
        if (offset.compareTo(window) > 0 || offset.compareTo(FULL_DAY) >= 0) {
            return null;
        }
        return activation.plus(offset);
    }
}
