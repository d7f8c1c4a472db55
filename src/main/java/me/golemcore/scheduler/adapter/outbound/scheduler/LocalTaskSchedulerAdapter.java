package me.golemcore.scheduler.adapter.outbound.scheduler;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.task.ScheduledTask;
import me.golemcore.scheduler.domain.model.task.ScheduledTask.TaskState;
import me.golemcore.scheduler.domain.model.task.TaskDefinition;
import me.golemcore.scheduler.infrastructure.config.SchedulerProperties;
import me.golemcore.scheduler.port.outbound.HostSchedulerPort;
import me.golemcore.scheduler.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Host scheduler backed by JSON files in the workspace. Each folder is one
 * file under the tasks directory; a background tick starts due tasks as
 * detached processes.
 *
 * <p>
 * Tasks fire at most once per tick and never overlap with themselves. A task
 * whose occurrence passed while the application was down fires on the first
 * tick when its definition asks to start when available; otherwise it waits
 * for its next occurrence. Runs that exceed the execution time limit are
 * killed.
 *
 * <p>
 * With {@code scheduler.host.enabled=false} tasks are still stored but never
 * started, and the scheduler reports itself unavailable.
 */
@Component
@Slf4j
public class LocalTaskSchedulerAdapter implements HostSchedulerPort {

    private static final String FILE_EXTENSION = ".json";
    private static final TypeReference<List<ScheduledTask>> TASK_LIST = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final SchedulerProperties properties;
    private final Clock clock;

    private final Map<String, Folder> folders = new HashMap<>();
    private final Map<String, ActiveRun> activeRuns = new HashMap<>();
    private ScheduledExecutorService ticker;

    public LocalTaskSchedulerAdapter(StoragePort storagePort, ObjectMapper objectMapper,
            SchedulerProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    private record Folder(String name, Map<String, ScheduledTask> tasks) {
    }

    private record ActiveRun(Process process, Instant startedAt, Duration limit) {
    }

    @PostConstruct
    public void start() {
        loadAllFolders();
        if (!properties.getHost().isEnabled()) {
            log.info("[HostScheduler] Disabled, tasks will not be started");
            return;
        }
        long tickMillis = properties.getHost().getTickInterval().toMillis();
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "host-scheduler");
            t.setDaemon(true);
            return t;
        });
        ticker.scheduleAtFixedRate(this::tick, tickMillis, tickMillis, TimeUnit.MILLISECONDS);
        log.info("[HostScheduler] Started with {} folder(s), tick {} ms", folders.size(), tickMillis);
    }

    @PreDestroy
    public void shutdown() {
        if (ticker == null) {
            return;
        }
        ticker.shutdown();
        try {
            if (!ticker.awaitTermination(5, TimeUnit.SECONDS)) {
                ticker.shutdownNow();
            }
        } catch (InterruptedException e) {
            ticker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isAvailable() {
        return properties.getHost().isEnabled();
    }

    @Override
    public synchronized List<ScheduledTask> listTasks(String folder) {
        return folder(folder).tasks().values().stream()
                .sorted(Comparator.comparing(ScheduledTask::getName, String.CASE_INSENSITIVE_ORDER))
                .map(LocalTaskSchedulerAdapter::copy)
                .toList();
    }

    @Override
    public synchronized Optional<ScheduledTask> findTask(String folder, String name) {
        return Optional.ofNullable(folder(folder).tasks().get(key(name))).map(LocalTaskSchedulerAdapter::copy);
    }

    @Override
    public synchronized void registerTask(String folder, String name, TaskDefinition definition) {
        Folder target = folder(folder);
        ScheduledTask existing = target.tasks().get(key(name));
        ScheduledTask task = ScheduledTask.builder()
                .name(name)
                .definition(definition)
                .enabled(existing == null || existing.isEnabled())
                .lastRunTime(existing != null ? existing.getLastRunTime() : null)
                .build();
        task.setState(stateOf(target, task));
        task.setNextRunTime(task.isEnabled() ? nextOccurrence(definition, clock.instant()) : null);
        if (existing != null && !existing.getName().equals(name)) {
            target.tasks().remove(key(existing.getName()));
        }
        target.tasks().put(key(name), task);
        save(target);
        log.debug("[HostScheduler] Registered '{}/{}', next run {}", target.name(), name, task.getNextRunTime());
    }

    @Override
    public synchronized void deleteTask(String folder, String name) {
        Folder target = folder(folder);
        if (target.tasks().remove(key(name)) == null) {
            throw new IllegalArgumentException("Task not found: " + name);
        }
        save(target);
        log.debug("[HostScheduler] Deleted '{}/{}'", target.name(), name);
    }

    @Override
    public synchronized void setEnabled(String folder, String name, boolean enabled) {
        Folder target = folder(folder);
        ScheduledTask task = target.tasks().get(key(name));
        if (task == null) {
            throw new IllegalArgumentException("Task not found: " + name);
        }
        task.setEnabled(enabled);
        task.setState(stateOf(target, task));
        task.setNextRunTime(enabled ? nextOccurrence(task.getDefinition(), clock.instant()) : null);
        save(target);
    }

    /**
     * Start every due task and enforce execution time limits. Package-private
     * so tests can drive the scheduler without the background thread.
     */
    synchronized void tick() {
        Instant now = clock.instant();
        try {
            enforceTimeLimits(now);
            for (Folder folder : folders.values()) {
                boolean changed = false;
                for (ScheduledTask task : folder.tasks().values()) {
                    if (isDue(task, now) && !activeRuns.containsKey(runKey(folder, task.getName()))) {
                        launch(folder, task, now);
                        changed = true;
                    }
                }
                if (changed) {
                    save(folder);
                }
            }
        } catch (RuntimeException e) {
            log.error("[HostScheduler] Tick failed", e);
        }
    }

    synchronized boolean isRunning(String folder, String name) {
        return activeRuns.containsKey(key(folder) + "/" + key(name));
    }

    private static boolean isDue(ScheduledTask task, Instant now) {
        return task.isEnabled() && task.getNextRunTime() != null && !now.isBefore(task.getNextRunTime());
    }

    private void launch(Folder folder, ScheduledTask task, Instant now) {
        task.setLastRunTime(now);
        task.setNextRunTime(nextOccurrence(task.getDefinition(), now));
        if (task.getDefinition() == null || task.getDefinition().getAction() == null) {
            log.warn("[HostScheduler] Task '{}' has no action", task.getName());
            return;
        }
        List<String> commandLine = task.getDefinition().getAction().commandLine();
        try {
            Process process = new ProcessBuilder(commandLine)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .redirectError(ProcessBuilder.Redirect.DISCARD)
                    .start();
            String runKey = runKey(folder, task.getName());
            activeRuns.put(runKey, new ActiveRun(process, now, task.getDefinition().getExecutionTimeLimit()));
            task.setState(TaskState.RUNNING);
            process.onExit().thenRun(() -> finished(folder, runKey, process));
            log.info("[HostScheduler] Started '{}' (pid {}), next run {}", task.getName(), process.pid(),
                    task.getNextRunTime());
        } catch (IOException e) {
            log.error("[HostScheduler] Failed to start '{}': {}", task.getName(), e.getMessage());
        }
    }

    private synchronized void finished(Folder folder, String runKey, Process process) {
        ActiveRun run = activeRuns.get(runKey);
        if (run == null || run.process() != process) {
            return;
        }
        activeRuns.remove(runKey);
        String taskKey = runKey.substring(runKey.indexOf('/') + 1);
        ScheduledTask task = folder.tasks().get(taskKey);
        if (task != null) {
            task.setState(task.isEnabled() ? TaskState.READY : TaskState.DISABLED);
        }
        log.debug("[HostScheduler] Task '{}' exited with {}", taskKey, process.exitValue());
    }

    private void enforceTimeLimits(Instant now) {
        for (Map.Entry<String, ActiveRun> entry : activeRuns.entrySet()) {
            ActiveRun run = entry.getValue();
            if (run.limit() == null || run.limit().isZero() || !run.process().isAlive()) {
                continue;
            }
            if (Duration.between(run.startedAt(), now).compareTo(run.limit()) > 0) {
                log.warn("[HostScheduler] Task '{}' exceeded {} and is being stopped", entry.getKey(), run.limit());
                run.process().descendants().forEach(ProcessHandle::destroyForcibly);
                run.process().destroyForcibly();
            }
        }
    }

    private TaskState stateOf(Folder folder, ScheduledTask task) {
        if (activeRuns.containsKey(runKey(folder, task.getName()))) {
            return TaskState.RUNNING;
        }
        return task.isEnabled() ? TaskState.READY : TaskState.DISABLED;
    }

    private Instant nextOccurrence(TaskDefinition definition, Instant after) {
        if (definition == null) {
            return null;
        }
        ZoneId zone = clock.getZone();
        return TriggerOccurrences.next(definition.getTriggers(), LocalDateTime.ofInstant(after, zone))
                .map(time -> time.atZone(zone).toInstant())
                .orElse(null);
    }

    private Folder folder(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task folder is required");
        }
        return folders.computeIfAbsent(key(name), k -> load(name));
    }

    private void loadAllFolders() {
        String tasksDirectory = properties.getStorage().getTasksDirectory();
        try {
            List<String> files = storagePort.listObjects(tasksDirectory, "").join();
            synchronized (this) {
                for (String file : files) {
                    if (file.endsWith(FILE_EXTENSION) && !file.contains("/")) {
                        String name = file.substring(0, file.length() - FILE_EXTENSION.length());
                        folders.computeIfAbsent(key(name), k -> load(name));
                    }
                }
            }
        } catch (RuntimeException e) {
            log.warn("[HostScheduler] Failed to list task folders: {}", e.getMessage());
        }
    }

    private Folder load(String name) {
        Map<String, ScheduledTask> tasks = new LinkedHashMap<>();
        Folder folder = new Folder(name, tasks);
        String json;
        try {
            json = storagePort.getText(properties.getStorage().getTasksDirectory(), fileName(name)).join();
        } catch (RuntimeException e) {
            log.warn("[HostScheduler] Failed to read folder '{}': {}", name, e.getMessage());
            return folder;
        }
        if (json == null || json.isBlank()) {
            return folder;
        }
        try {
            Instant now = clock.instant();
            for (ScheduledTask task : objectMapper.readValue(json, TASK_LIST)) {
                restore(task, now);
                tasks.put(key(task.getName()), task);
            }
            log.info("[HostScheduler] Loaded {} task(s) from folder '{}'", tasks.size(), name);
        } catch (JsonProcessingException e) {
            log.error("[HostScheduler] Folder '{}' is corrupted: {}", name, e.getMessage());
        }
        return folder;
    }

    private void restore(ScheduledTask task, Instant now) {
        task.setState(task.isEnabled() ? TaskState.READY : TaskState.DISABLED);
        if (!task.isEnabled()) {
            task.setNextRunTime(null);
            return;
        }
        Instant stored = task.getNextRunTime();
        boolean missed = stored != null && stored.isBefore(now);
        boolean catchUp = missed && task.getDefinition() != null && task.getDefinition().isStartWhenAvailable();
        if (stored == null || (missed && !catchUp)) {
            task.setNextRunTime(nextOccurrence(task.getDefinition(), now));
        }
    }

    private void save(Folder folder) {
        List<ScheduledTask> tasks = new ArrayList<>(folder.tasks().values());
        String json;
        try {
            json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(tasks);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize task folder " + folder.name(), e);
        }
        storagePort.putTextAtomic(properties.getStorage().getTasksDirectory(), fileName(folder.name()), json, true)
                .join();
    }

    private static ScheduledTask copy(ScheduledTask task) {
        return task.toBuilder().build();
    }

    private static String fileName(String folder) {
        return folder + FILE_EXTENSION;
    }

    private static String runKey(Folder folder, String name) {
        return key(folder.name()) + "/" + key(name);
    }

    private static String key(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Task name is required");
        }
        return name.toLowerCase(Locale.ROOT);
    }
}
