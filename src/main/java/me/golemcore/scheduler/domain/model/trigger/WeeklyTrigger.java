package me.golemcore.scheduler.domain.model.trigger;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

public record WeeklyTrigger(LocalDateTime startBoundary, Set<DayOfWeek> daysOfWeek, Repetition repetition)
        implements Trigger {

    public WeeklyTrigger {
        repetition = repetition == null ? Repetition.NONE : repetition;
        daysOfWeek = daysOfWeek == null || daysOfWeek.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(daysOfWeek));
    }
}
