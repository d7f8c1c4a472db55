package me.golemcore.scheduler.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.scheduler.domain.model.Schedule;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class JobRequest {
    private String name;
    private String prompt;
    private Schedule schedule;
    private boolean silent;
    private Boolean enabled;
    private String agentOverride;
    private String hexColor;
    private String icon;
}
