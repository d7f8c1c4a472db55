package me.golemcore.scheduler.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import me.golemcore.scheduler.domain.model.RunEntry;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunDto {
    private long id;
    private String jobName;
    private Instant startTime;
    private Instant endTime;
    private int exitCode;
    private String status;
    private String prompt;
    private String command;
    private String standardOutput;
    private String standardError;
    private double durationSeconds;
    private String agentName;
    private String logFilePath;
    private boolean favorite;

    public static RunDto from(RunEntry entry) {
        return RunDto.builder()
                .id(entry.getId())
                .jobName(entry.getJobName())
                .startTime(entry.getStartTime())
                .endTime(entry.getEndTime())
                .exitCode(entry.getExitCode())
                .status(entry.getStatus() != null ? entry.getStatus().name() : null)
                .prompt(entry.getPrompt())
                .command(entry.getCommand())
                .standardOutput(entry.getStandardOutput())
                .standardError(entry.getStandardError())
                .durationSeconds(entry.getDurationSeconds())
                .agentName(entry.getAgentName())
                .logFilePath(entry.getLogFilePath())
                .favorite(entry.isFavorite())
                .build();
    }
}
