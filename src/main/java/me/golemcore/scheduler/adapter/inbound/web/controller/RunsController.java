package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.adapter.inbound.web.dto.RunDto;
import me.golemcore.scheduler.adapter.inbound.web.dto.RunsPageResponse;
import me.golemcore.scheduler.domain.model.RunEntry;
import me.golemcore.scheduler.domain.model.RunFilter;
import me.golemcore.scheduler.domain.model.RunStatus;
import me.golemcore.scheduler.domain.service.RunReportFormatter;
import me.golemcore.scheduler.port.outbound.RunStorePort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;

/**
 * Run history endpoints.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RunsController {

    private static final int MAX_LIMIT = 500;

    private final RunStorePort runStore;
    private final RunReportFormatter reportFormatter;

    @GetMapping("/runs")
    public Mono<ResponseEntity<RunsPageResponse>> getRuns(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "false") boolean favorites) {
        validatePage(limit, offset);
        RunFilter filter = new RunFilter(parseStatus(status), favorites);
        List<RunDto> runs = runStore.findRecent(limit, offset, filter).stream().map(RunDto::from).toList();
        RunsPageResponse response = RunsPageResponse.builder()
                .runs(runs)
                .total(runStore.countRecent(filter))
                .limit(limit)
                .offset(offset)
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }

    @GetMapping("/runs/search")
    public Mono<ResponseEntity<List<RunDto>>> search(
            @RequestParam("q") String query,
            @RequestParam(defaultValue = "50") int limit) {
        if (query == null || query.isBlank()) {
            throw badRequest("q is required");
        }
        validatePage(limit, 0);
        return Mono.just(ResponseEntity.ok(runStore.search(query.trim(), limit).stream().map(RunDto::from).toList()));
    }

    @GetMapping("/runs/{id}")
    public Mono<ResponseEntity<RunDto>> getRun(@PathVariable long id) {
        return Mono.just(ResponseEntity.ok(RunDto.from(requireRun(id))));
    }

    @GetMapping(value = "/runs/{id}/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> getReport(@PathVariable long id) {
        return Mono.just(ResponseEntity.ok(reportFormatter.format(requireRun(id))));
    }

    @GetMapping("/jobs/{name}/runs")
    public Mono<ResponseEntity<List<RunDto>>> getJobRuns(@PathVariable String name) {
        return Mono.just(ResponseEntity.ok(runStore.findByJob(name).stream().map(RunDto::from).toList()));
    }

    @DeleteMapping("/runs/{id}")
    public Mono<ResponseEntity<DeleteRunsResponse>> deleteRun(@PathVariable long id) {
        if (!runStore.deleteById(id)) {
            throw notFound(id);
        }
        return Mono.just(ResponseEntity.ok(new DeleteRunsResponse(1)));
    }

    @DeleteMapping("/runs")
    public Mono<ResponseEntity<DeleteRunsResponse>> deleteAll() {
        return Mono.just(ResponseEntity.ok(new DeleteRunsResponse(runStore.deleteAll())));
    }

    @DeleteMapping("/jobs/{name}/runs")
    public Mono<ResponseEntity<DeleteRunsResponse>> deleteJobRuns(@PathVariable String name) {
        return Mono.just(ResponseEntity.ok(new DeleteRunsResponse(runStore.deleteByJob(name))));
    }

    @PostMapping("/runs/{id}/favorite")
    public Mono<ResponseEntity<RunDto>> setFavorite(@PathVariable long id, @RequestBody FavoriteRequest request) {
        if (request == null || request.favorite() == null) {
            throw badRequest("favorite is required");
        }
        if (!runStore.setFavorite(id, request.favorite())) {
            throw notFound(id);
        }
        return Mono.just(ResponseEntity.ok(RunDto.from(requireRun(id))));
    }

    private RunEntry requireRun(long id) {
        return runStore.findById(id).orElseThrow(() -> notFound(id));
    }

    private static RunStatus parseStatus(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("SUCCESS".equals(normalized)) {
            return RunStatus.SUCCESS;
        }
        if ("FAILURE".equals(normalized) || "FAILED".equals(normalized)) {
            return RunStatus.FAILURE;
        }
        throw badRequest("Unsupported status: " + value);
    }

    private static void validatePage(int limit, int offset) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw badRequest("limit must be between 1 and " + MAX_LIMIT);
        }
        if (offset < 0) {
            throw badRequest("offset must not be negative");
        }
    }

    private static ResponseStatusException notFound(long id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Run not found: " + id);
    }

    private static ResponseStatusException badRequest(String message) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, message);
    }

    public record FavoriteRequest(Boolean favorite) {
    }

    public record DeleteRunsResponse(int deleted) {
    }
}
