package me.golemcore.scheduler.domain.model;

/**
 * Lifecycle of an in-process run started on demand.
 */
public enum ManualRunStatus {
    RUNNING, COMPLETED, FAILED, CANCELLED
}
