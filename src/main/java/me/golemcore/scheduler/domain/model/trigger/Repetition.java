package me.golemcore.scheduler.domain.model.trigger;

import java.time.Duration;

/**
 * Repeats a trigger every {@code interval} for {@code duration} after each
 * activation. A zero interval means the trigger fires once per activation.
 */
public record Repetition(Duration interval, Duration duration) {

    public static final Repetition NONE = new Repetition(Duration.ZERO, Duration.ZERO);

    public Repetition {
        interval = interval == null ? Duration.ZERO : interval;
        duration = duration == null ? Duration.ZERO : duration;
    }

    public static Repetition every(Duration interval, Duration duration) {
        return new Repetition(interval, duration);
    }

    public boolean repeats() {
        return interval.compareTo(Duration.ZERO) > 0;
    }
}
