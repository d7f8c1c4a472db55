package me.golemcore.scheduler.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.scheduler.domain.model.Schedule;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobDto {
    private String name;
    private String prompt;
    private Schedule schedule;
    private String scheduleDescription;
    private boolean silent;
    private boolean enabled;
    private String agentOverride;
    private String agentName;
    private String hexColor;
    private String icon;
    private Instant lastRunTime;
    private Instant nextRunTime;
    private boolean running;
}
