package me.golemcore.scheduler.domain.model.trigger;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Fires on the given days of every month. Days beyond the length of a month
 * are skipped for that month.
 */
public record MonthlyTrigger(LocalDateTime startBoundary, List<Integer> daysOfMonth) implements Trigger {

    public MonthlyTrigger {
        daysOfMonth = daysOfMonth == null ? List.of() : daysOfMonth.stream().sorted().distinct().toList();
    }
}
