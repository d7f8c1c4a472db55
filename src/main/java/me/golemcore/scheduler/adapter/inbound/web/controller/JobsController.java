package me.golemcore.scheduler.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.scheduler.adapter.inbound.web.dto.JobDto;
import me.golemcore.scheduler.adapter.inbound.web.dto.JobRequest;
import me.golemcore.scheduler.adapter.inbound.web.dto.ManualRunDto;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.service.AgentCatalog;
import me.golemcore.scheduler.domain.service.JobRegistryService;
import me.golemcore.scheduler.domain.service.JobRunInvocation;
import me.golemcore.scheduler.domain.service.ManualRunService;
import me.golemcore.scheduler.domain.service.ScheduleDescriber;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

/**
 * Job management endpoints.
 */
@RestController
@RequestMapping("/api/jobs")
@RequiredArgsConstructor
public class JobsController {

    private final JobRegistryService jobRegistry;
    private final ManualRunService manualRuns;
    private final JobRunInvocation runInvocation;
    private final ScheduleDescriber scheduleDescriber;

    @GetMapping
    public Mono<ResponseEntity<JobsResponse>> getJobs() {
        List<JobDto> jobs = jobRegistry.getAllJobs().stream()
                .sorted(Comparator.comparing(Job::getName, String.CASE_INSENSITIVE_ORDER))
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(new JobsResponse(jobRegistry.isSchedulerAvailable(), jobs)));
    }

    @GetMapping("/{name}")
    public Mono<ResponseEntity<JobDto>> getJob(@PathVariable String name) {
        return Mono.just(ResponseEntity.ok(toDto(requireJob(name))));
    }

    @PostMapping
    public Mono<ResponseEntity<JobDto>> createJob(@RequestBody JobRequest request) {
        Job job = toJob(request);
        jobRegistry.createJob(job);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(reload(job.getName()))));
    }

    @PutMapping("/{name}")
    public Mono<ResponseEntity<JobDto>> updateJob(@PathVariable String name, @RequestBody JobRequest request) {
        requireJob(name);
        Job job = toJob(request);
        jobRegistry.updateJob(name, job);
        return Mono.just(ResponseEntity.ok(toDto(reload(job.getName()))));
    }

    @DeleteMapping("/{name}")
    public Mono<ResponseEntity<DeleteJobResponse>> deleteJob(@PathVariable String name) {
        Job job = requireJob(name);
        jobRegistry.deleteJob(job.getName());
        return Mono.just(ResponseEntity.ok(new DeleteJobResponse(job.getName())));
    }

    @PostMapping("/{name}/enabled")
    public Mono<ResponseEntity<JobDto>> setEnabled(@PathVariable String name, @RequestBody EnabledRequest request) {
        if (request == null || request.enabled() == null) {
            throw badRequest("enabled is required");
        }
        Job job = requireJob(name);
        jobRegistry.setJobEnabled(job.getName(), request.enabled());
        return Mono.just(ResponseEntity.ok(toDto(reload(job.getName()))));
    }

    @PostMapping("/pause")
    public Mono<ResponseEntity<BulkUpdateResponse>> pauseAll() {
        return Mono.just(ResponseEntity.ok(new BulkUpdateResponse(jobRegistry.pauseAllJobs())));
    }

    @PostMapping("/resume")
    public Mono<ResponseEntity<BulkUpdateResponse>> resumeAll() {
        return Mono.just(ResponseEntity.ok(new BulkUpdateResponse(jobRegistry.resumeAllJobs())));
    }

    @PostMapping("/update-all")
    public Mono<ResponseEntity<BulkUpdateResponse>> updateAll() {
        return Mono.just(ResponseEntity.ok(new BulkUpdateResponse(jobRegistry.updateAllJobs())));
    }

    @PostMapping("/{name}/run")
    public Mono<ResponseEntity<ManualRunDto>> runNow(@PathVariable String name) {
        Job job = requireJob(name);
        return Mono.just(ResponseEntity.status(HttpStatus.ACCEPTED).body(ManualRunDto.from(manualRuns.start(job))));
    }

    private Job requireJob(String name) {
        return jobRegistry.findJob(name)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Job not found: " + name));
    }

    private Job reload(String name) {
        return jobRegistry.findJob(name)
                .orElseThrow(() -> new IllegalStateException("Job was not stored: " + name));
    }

    private JobDto toDto(Job job) {
        return JobDto.builder()
                .name(job.getName())
                .prompt(job.getPrompt())
                .schedule(job.getSchedule())
                .scheduleDescription(scheduleDescriber.describe(job.getSchedule()))
                .silent(job.isSilent())
                .enabled(job.isEnabled())
                .agentOverride(job.getAgentOverride())
                .agentName(AgentCatalog.agentName(runInvocation.commandFor(job)))
                .hexColor(job.getHexColor())
                .icon(job.getIcon())
                .lastRunTime(job.getLastRunTime())
                .nextRunTime(job.getNextRunTime())
                .running(job.isRunning())
                .build();
    }

    private static Job toJob(JobRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        return Job.builder()
                .name(trimToNull(request.getName()))
                .prompt(request.getPrompt())
                .schedule(request.getSchedule())
                .silent(request.isSilent())
                .enabled(request.getEnabled() == null || request.getEnabled())
                .agentOverride(trimToNull(request.getAgentOverride()))
                .hexColor(trimToNull(request.getHexColor()))
                .icon(trimToNull(request.getIcon()))
                .build();
    }

    private static String trimToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static ResponseStatusException badRequest(String message) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, message);
    }

    public record JobsResponse(boolean schedulerAvailable, List<JobDto> jobs) {
    }

    public record EnabledRequest(Boolean enabled) {
    }

    public record DeleteJobResponse(String name) {
    }

    public record BulkUpdateResponse(int updated) {
    }
}
