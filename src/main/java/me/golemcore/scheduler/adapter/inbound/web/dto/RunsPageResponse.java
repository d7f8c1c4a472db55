package me.golemcore.scheduler.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of the run history, newest first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunsPageResponse {
    private List<RunDto> runs;
    private int total;
    private int limit;
    private int offset;
}
