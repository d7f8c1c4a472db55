package me.golemcore.scheduler.domain.model;

/**
 * Captured outcome of an agent process. Output streams are trimmed at the
 * end.
 */
public record CommandResult(int exitCode, String standardOutput, String standardError, boolean timedOut,
        boolean cancelled) {
}
