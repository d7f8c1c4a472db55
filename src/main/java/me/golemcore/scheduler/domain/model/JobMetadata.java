package me.golemcore.scheduler.domain.model;

/**
 * Job identity carried in a host task's description field.
 */
public record JobMetadata(String prompt, boolean silent, String agentOverride, String hexColor, String icon) {
}
