package me.golemcore.scheduler.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.scheduler.domain.service.ManualRun;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualRunDto {
    private String id;
    private String jobName;
    private String status;
    private Instant startedAt;
    private String output;

    public static ManualRunDto from(ManualRun run) {
        return ManualRunDto.builder()
                .id(run.getId())
                .jobName(run.getJobName())
                .status(run.getStatus().name())
                .startedAt(run.getStartedAt())
                .output(run.getOutput())
                .build();
    }
}
