package me.golemcore.scheduler.domain.model;

import java.time.Instant;

/**
 * Signals that job or run listings changed and views should reload.
 */
public record RunsRefreshedEvent(Reason reason, long lastProcessedId, int processedCount, Instant timestamp) {

    public enum Reason {
        NEW_RUNS, JOBS_CHANGED
    }
}
