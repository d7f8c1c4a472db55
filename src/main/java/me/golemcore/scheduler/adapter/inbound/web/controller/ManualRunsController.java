package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.adapter.inbound.web.dto.ManualRunDto;
import me.golemcore.scheduler.domain.service.ManualRun;
import me.golemcore.scheduler.domain.service.ManualRunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

/**
 * Status and cancellation of runs started with "run now".
 */
@RestController
@RequestMapping("/api/manual-runs")
@RequiredArgsConstructor
public class ManualRunsController {

    private final ManualRunService manualRuns;

    @GetMapping
    public Mono<ResponseEntity<List<ManualRunDto>>> getRuns() {
        List<ManualRunDto> runs = manualRuns.getRuns().stream()
                .sorted(Comparator.comparing(ManualRun::getStartedAt).reversed())
                .map(ManualRunDto::from)
                .toList();
        return Mono.just(ResponseEntity.ok(runs));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<ManualRunDto>> getRun(@PathVariable String id) {
        return Mono.just(ResponseEntity.ok(ManualRunDto.from(requireRun(id))));
    }

    @PostMapping("/{id}/cancel")
    public Mono<ResponseEntity<ManualRunDto>> cancel(@PathVariable String id) {
        ManualRun run = requireRun(id);
        if (!manualRuns.cancel(id)) {
            throw new IllegalStateException("Run already finished: " + id);
        }
        return Mono.just(ResponseEntity.ok(ManualRunDto.from(run)));
    }

    private ManualRun requireRun(String id) {
        return manualRuns.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id));
    }
}
