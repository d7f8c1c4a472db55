package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.Schedule;
import me.golemcore.scheduler.domain.model.task.ScheduledTask;
import me.golemcore.scheduler.domain.model.task.TaskDefinition;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.HostSchedulerPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JobRegistryServiceTest {

    private static final String FOLDER = "GolemCore";
    private static final Instant FIXED_NOW = Instant.parse("2026-03-10T12:00:00Z");

    private HostSchedulerPort hostScheduler;
    private TriggerTranslator translator;
    private JobMetadataCodec codec;
    private SchedulerProperties properties;
    private JobRegistryService service;

    @BeforeEach
    void setUp() {
        hostScheduler = mock(HostSchedulerPort.class);
        translator = new TriggerTranslator(Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
        codec = new JobMetadataCodec();
        properties = new SchedulerProperties();
        properties.getHost().setLauncher(List.of("java", "-jar", "scheduler.jar"));
        service = new JobRegistryService(hostScheduler, translator, codec, new JobRunInvocation(properties),
                properties);
    }

    @Test
    void shouldRegisterNewJobWithEnvelopeTriggersAndAction() {
        when(hostScheduler.findTask(FOLDER, "Digest")).thenReturn(Optional.empty());

        service.createJob(job("Digest"));

        ArgumentCaptor<TaskDefinition> captor = ArgumentCaptor.forClass(TaskDefinition.class);
        verify(hostScheduler).registerTask(eq(FOLDER), eq("Digest"), captor.capture());
        verify(hostScheduler, never()).setEnabled(anyString(), anyString(), anyBoolean());
        TaskDefinition definition = captor.getValue();
        assertEquals("Summarize the news", codec.decode(definition.getDescription()).orElseThrow().prompt());
        assertEquals(1, definition.getTriggers().size());
        assertEquals("java", definition.getAction().executable());
        assertEquals(List.of("-jar", "scheduler.jar", "--run-job", "Digest"),
                definition.getAction().arguments().subList(0, 4));
        assertEquals(Duration.ofHours(1), definition.getExecutionTimeLimit());
        assertTrue(definition.isStartWhenAvailable());
    }

    @Test
    void shouldDisableJobCreatedDisabled() {
        when(hostScheduler.findTask(FOLDER, "Digest")).thenReturn(Optional.empty());
        Job job = job("Digest");
        job.setEnabled(false);

        service.createJob(job);

        verify(hostScheduler).setEnabled(FOLDER, "Digest", false);
    }

    @Test
    void shouldRejectDuplicateJob() {
        when(hostScheduler.findTask(FOLDER, "Digest")).thenReturn(Optional.of(task("digest", job("digest"))));

        assertThrows(IllegalStateException.class, () -> service.createJob(job("Digest")));
        verify(hostScheduler, never()).registerTask(any(), any(), any());
    }

    @Test
    void shouldRejectInvalidJobs() {
        Job noPrompt = job("Digest");
        noPrompt.setPrompt(" ");
        Job noSchedule = job("Digest");
        noSchedule.setSchedule(null);
        Job badInterval = job("Digest");
        badInterval.setSchedule(Schedule.minutes(0));

        assertThrows(IllegalArgumentException.class, () -> service.createJob(null));
        assertThrows(IllegalArgumentException.class, () -> service.createJob(job(" ")));
        assertThrows(IllegalArgumentException.class, () -> service.createJob(noPrompt));
        assertThrows(IllegalArgumentException.class, () -> service.createJob(noSchedule));
        assertThrows(IllegalArgumentException.class, () -> service.createJob(badInterval));
    }

    @Test
    void shouldRenameByRegisteringNewNameBeforeDeletingOld() {
        when(hostScheduler.findTask(FOLDER, "Old")).thenReturn(Optional.of(task("Old", job("Old"))));
        when(hostScheduler.findTask(FOLDER, "New")).thenReturn(Optional.empty());

        service.updateJob("Old", job("New"));

        InOrder order = inOrder(hostScheduler);
        order.verify(hostScheduler).registerTask(eq(FOLDER), eq("New"), any());
        order.verify(hostScheduler).setEnabled(FOLDER, "New", true);
        order.verify(hostScheduler).deleteTask(FOLDER, "Old");
    }

    @Test
    void shouldUpdateInPlaceWhenOnlyCaseChanges() {
        when(hostScheduler.findTask(FOLDER, "digest")).thenReturn(Optional.of(task("digest", job("digest"))));

        service.updateJob("digest", job("Digest"));

        verify(hostScheduler).registerTask(eq(FOLDER), eq("Digest"), any());
        verify(hostScheduler, never()).deleteTask(any(), any());
    }

    @Test
    void shouldRejectRenameOntoExistingJob() {
        when(hostScheduler.findTask(FOLDER, "Old")).thenReturn(Optional.of(task("Old", job("Old"))));
        when(hostScheduler.findTask(FOLDER, "Taken")).thenReturn(Optional.of(task("Taken", job("Taken"))));

        assertThrows(IllegalStateException.class, () -> service.updateJob("Old", job("Taken")));
    }

    @Test
    void shouldRejectUpdateOfMissingJob() {
        when(hostScheduler.findTask(FOLDER, "Ghost")).thenReturn(Optional.empty());

        assertThrows(IllegalArgumentException.class, () -> service.updateJob("Ghost", job("Ghost")));
    }

    @Test
    void shouldListOnlyManagedTasks() {
        ScheduledTask foreign = ScheduledTask.builder()
                .name("Backup")
                .definition(TaskDefinition.builder().description("Nightly backup").build())
                .build();
        ScheduledTask managed = task("Digest", job("Digest"));
        managed.setLastRunTime(Instant.parse("1999-11-30T00:00:00Z"));
        managed.setNextRunTime(Instant.parse("2026-03-11T09:00:00Z"));
        managed.setState(ScheduledTask.TaskState.RUNNING);
        when(hostScheduler.listTasks(FOLDER)).thenReturn(List.of(foreign, managed));

        List<Job> jobs = service.getAllJobs();

        assertEquals(1, jobs.size());
        Job job = jobs.get(0);
        assertEquals("Digest", job.getName());
        assertEquals("Summarize the news", job.getPrompt());
        assertEquals(Schedule.ScheduleType.DAILY, job.getSchedule().getType());
        assertEquals(LocalTime.of(7, 30), job.getSchedule().getRunTime());
        assertNull(job.getLastRunTime());
        assertEquals(Instant.parse("2026-03-11T09:00:00Z"), job.getNextRunTime());
        assertTrue(job.isRunning());
    }

    @Test
    void shouldReturnEmptyListWhenHostSchedulerFails() {
        when(hostScheduler.listTasks(FOLDER)).thenThrow(new IllegalStateException("service down"));

        assertTrue(service.getAllJobs().isEmpty());
        assertTrue(service.findJob("Digest").isEmpty());
    }

    @Test
    void shouldFindJobIgnoringCase() {
        when(hostScheduler.listTasks(FOLDER)).thenReturn(List.of(task("Digest", job("Digest"))));

        assertTrue(service.findJob("DIGEST").isPresent());
        assertFalse(service.findJob("other").isPresent());
    }

    @Test
    void shouldPauseOnlyEnabledJobsAndContinueAfterFailure() {
        ScheduledTask first = task("A", job("A"));
        ScheduledTask second = task("B", job("B"));
        ScheduledTask paused = task("C", job("C"));
        paused.setEnabled(false);
        when(hostScheduler.listTasks(FOLDER)).thenReturn(List.of(first, second, paused));
        doThrow(new IllegalArgumentException("gone")).when(hostScheduler).setEnabled(FOLDER, "A", false);

        int changed = service.pauseAllJobs();

        assertEquals(1, changed);
        verify(hostScheduler).setEnabled(FOLDER, "B", false);
        verify(hostScheduler, never()).setEnabled(FOLDER, "C", false);
    }

    @Test
    void shouldReRegisterAllJobs() {
        when(hostScheduler.listTasks(FOLDER)).thenReturn(List.of(task("A", job("A")), task("B", job("B"))));

        assertEquals(2, service.updateAllJobs());
        verify(hostScheduler).registerTask(eq(FOLDER), eq("A"), any());
        verify(hostScheduler).registerTask(eq(FOLDER), eq("B"), any());
    }

    @Test
    void shouldReportUnavailableSchedulerWhenCheckThrows() {
        when(hostScheduler.isAvailable()).thenThrow(new IllegalStateException("rpc"));

        assertFalse(service.isSchedulerAvailable());
    }

    private ScheduledTask task(String name, Job job) {
        TaskDefinition definition = TaskDefinition.builder()
                .description(codec.encode(job))
                .triggers(translator.toTriggers(job.getSchedule()))
                .build();
        return ScheduledTask.builder().name(name).definition(definition).build();
    }

    private static Job job(String name) {
        return Job.builder()
                .name(name)
                .prompt("Summarize the news")
                .schedule(Schedule.daily(LocalTime.of(7, 30)))
                .build();
    }
}
