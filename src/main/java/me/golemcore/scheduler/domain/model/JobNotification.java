package me.golemcore.scheduler.domain.model;

/**
 * User-facing notice about a finished run.
 */
public record JobNotification(
        long runId,
        String jobName,
        boolean success,
        String title,
        String message,
        String outputPreview,
        String hexColor,
        String icon) {
}
