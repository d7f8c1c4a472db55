package me.golemcore.scheduler.adapter.inbound.web.controller;

import me.golemcore.scheduler.adapter.inbound.web.dto.JobDto;
import me.golemcore.scheduler.adapter.inbound.web.dto.JobRequest;
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.ManualRunStatus;
import me.golemcore.scheduler.domain.model.Schedule;
import me.golemcore.scheduler.domain.service.JobRegistryService;
import me.golemcore.scheduler.domain.service.JobRunInvocation;
import me.golemcore.scheduler.domain.service.ManualRun;
import me.golemcore.scheduler.domain.service.ManualRunService;
import me.golemcore.scheduler.domain.service.ScheduleDescriber;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobsControllerTest {

    private JobRegistryService jobRegistry;
    private ManualRunService manualRuns;
    private JobsController controller;

    @BeforeEach
    void setUp() {
        jobRegistry = mock(JobRegistryService.class);
        manualRuns = mock(ManualRunService.class);
        controller = new JobsController(jobRegistry, manualRuns, new JobRunInvocation(new SchedulerProperties()),
                new ScheduleDescriber());
    }

    @Test
    void getJobsShouldSortByNameAndReportAvailability() {
        Job override = job("beta");
        override.setAgentOverride("codex exec \"{prompt}\"");
        when(jobRegistry.getAllJobs()).thenReturn(List.of(override, job("Alpha")));
        when(jobRegistry.isSchedulerAvailable()).thenReturn(true);

        StepVerifier.create(controller.getJobs())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    JobsController.JobsResponse body = response.getBody();
                    assertNotNull(body);
                    assertTrue(body.schedulerAvailable());
                    assertEquals(List.of("Alpha", "beta"), body.jobs().stream().map(JobDto::getName).toList());
                    assertEquals("Daily at 09:00", body.jobs().get(0).getScheduleDescription());
                    assertEquals("Claude", body.jobs().get(0).getAgentName());
                    assertEquals("Codex", body.jobs().get(1).getAgentName());
                })
                .verifyComplete();
    }

    @Test
    void getJobShouldReturnNotFoundForUnknownJob() {
        when(jobRegistry.findJob("Ghost")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.getJob("Ghost"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    void createJobShouldTrimOptionalFieldsAndReturnCreated() {
        JobRequest request = request(" Digest ");
        request.setAgentOverride("  ");
        request.setHexColor(" #22AA88 ");
        when(jobRegistry.findJob("Digest")).thenReturn(Optional.of(job("Digest")));

        StepVerifier.create(controller.createJob(request))
                .assertNext(response -> {
                    assertEquals(HttpStatus.CREATED, response.getStatusCode());
                    assertEquals("Digest", response.getBody().getName());
                })
                .verifyComplete();

        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(jobRegistry).createJob(captor.capture());
        Job created = captor.getValue();
        assertEquals("Digest", created.getName());
        assertNull(created.getAgentOverride());
        assertEquals("#22AA88", created.getHexColor());
        assertTrue(created.isEnabled());
    }

    @Test
    void createJobShouldRejectMissingBody() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.createJob(null));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(jobRegistry, never()).createJob(any());
    }

    @Test
    void createJobShouldPropagateDuplicateName() {
        when(jobRegistry.findJob("Digest")).thenReturn(Optional.of(job("Digest")));
        doThrow(new IllegalStateException("Job already exists: Digest"))
                .when(jobRegistry).createJob(any());

        assertThrows(IllegalStateException.class, () -> controller.createJob(request("Digest")));
    }

    @Test
    void updateJobShouldPassOriginalName() {
        JobRequest request = request("Renamed");
        request.setEnabled(false);
        when(jobRegistry.findJob("Digest")).thenReturn(Optional.of(job("Digest")));
        when(jobRegistry.findJob("Renamed")).thenReturn(Optional.of(job("Renamed")));

        StepVerifier.create(controller.updateJob("Digest", request))
                .assertNext(response -> assertEquals("Renamed", response.getBody().getName()))
                .verifyComplete();

        ArgumentCaptor<Job> captor = ArgumentCaptor.forClass(Job.class);
        verify(jobRegistry).updateJob(eq("Digest"), captor.capture());
        assertFalse(captor.getValue().isEnabled());
    }

    @Test
    void deleteJobShouldUseStoredName() {
        when(jobRegistry.findJob("digest")).thenReturn(Optional.of(job("Digest")));

        StepVerifier.create(controller.deleteJob("digest"))
                .assertNext(response -> assertEquals("Digest", response.getBody().name()))
                .verifyComplete();

        verify(jobRegistry).deleteJob("Digest");
    }

    @Test
    void setEnabledShouldRequireFlag() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.setEnabled("Digest", new JobsController.EnabledRequest(null)));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void setEnabledShouldToggleJob() {
        Job disabled = job("Digest");
        disabled.setEnabled(false);
        when(jobRegistry.findJob("Digest")).thenReturn(Optional.of(job("Digest")), Optional.of(disabled));

        StepVerifier.create(controller.setEnabled("Digest", new JobsController.EnabledRequest(false)))
                .assertNext(response -> assertFalse(response.getBody().isEnabled()))
                .verifyComplete();

        verify(jobRegistry).setJobEnabled("Digest", false);
    }

    @Test
    void bulkEndpointsShouldReportCounts() {
        when(jobRegistry.pauseAllJobs()).thenReturn(3);
        when(jobRegistry.resumeAllJobs()).thenReturn(2);
        when(jobRegistry.updateAllJobs()).thenReturn(5);

        StepVerifier.create(controller.pauseAll())
                .assertNext(response -> assertEquals(3, response.getBody().updated()))
                .verifyComplete();
        StepVerifier.create(controller.resumeAll())
                .assertNext(response -> assertEquals(2, response.getBody().updated()))
                .verifyComplete();
        StepVerifier.create(controller.updateAll())
                .assertNext(response -> assertEquals(5, response.getBody().updated()))
                .verifyComplete();
    }

    @Test
    void runNowShouldStartManualRun() {
        Job job = job("Digest");
        ManualRun run = mock(ManualRun.class);
        when(run.getId()).thenReturn("run-1");
        when(run.getJobName()).thenReturn("Digest");
        when(run.getStatus()).thenReturn(ManualRunStatus.RUNNING);
        when(run.getStartedAt()).thenReturn(Instant.parse("2026-03-10T12:00:00Z"));
        when(run.getOutput()).thenReturn("");
        when(jobRegistry.findJob("Digest")).thenReturn(Optional.of(job));
        when(manualRuns.start(job)).thenReturn(run);

        StepVerifier.create(controller.runNow("Digest"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.ACCEPTED, response.getStatusCode());
                    assertEquals("run-1", response.getBody().getId());
                    assertEquals("RUNNING", response.getBody().getStatus());
                })
                .verifyComplete();
    }

    private static JobRequest request(String name) {
        JobRequest request = new JobRequest();
        request.setName(name);
        request.setPrompt("Summarize the news");
        request.setSchedule(Schedule.daily(LocalTime.of(9, 0)));
        return request;
    }

    private static Job job(String name) {
        return Job.builder()
                .name(name)
                .prompt("Summarize the news")
                .schedule(Schedule.daily(LocalTime.of(9, 0)))
                .build();
    }
}
