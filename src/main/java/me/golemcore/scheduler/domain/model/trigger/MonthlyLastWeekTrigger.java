package me.golemcore.scheduler.domain.model.trigger;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Fires in the last week of every month, on the latest day whose weekday is
 * selected. With every weekday selected this is the last day of the month.
 */
public record MonthlyLastWeekTrigger(LocalDateTime startBoundary, Set<DayOfWeek> daysOfWeek) implements Trigger {

    public MonthlyLastWeekTrigger {
        daysOfWeek = daysOfWeek == null || daysOfWeek.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(daysOfWeek));
    }

    public static MonthlyLastWeekTrigger lastDayOfMonth(LocalDateTime startBoundary) {
        return new MonthlyLastWeekTrigger(startBoundary, EnumSet.allOf(DayOfWeek.class));
    }
}
