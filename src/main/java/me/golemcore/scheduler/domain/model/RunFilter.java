package me.golemcore.scheduler.domain.model;

/**
 * Optional narrowing of the recent-runs listing. A null status matches both
 * outcomes.
 */
public record RunFilter(RunStatus status, boolean favoritesOnly) {

    public static final RunFilter NONE = new RunFilter(null, false);
}
