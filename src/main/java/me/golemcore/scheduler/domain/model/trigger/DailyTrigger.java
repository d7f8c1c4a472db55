package me.golemcore.scheduler.domain.model.trigger;

import java.time.LocalDateTime;

public record DailyTrigger(LocalDateTime startBoundary, int daysInterval, Repetition repetition) implements Trigger {

    public DailyTrigger {
        repetition = repetition == null ? Repetition.NONE : repetition;
        daysInterval = Math.max(1, daysInterval);
    }

    public static DailyTrigger at(LocalDateTime startBoundary) {
        return new DailyTrigger(startBoundary, 1, Repetition.NONE);
    }

    public static DailyTrigger repeating(LocalDateTime startBoundary, Repetition repetition) {
        return new DailyTrigger(startBoundary, 1, repetition);
    }
}
