package me.golemcore.scheduler.domain.service;

import me.golemcore.scheduler.domain.model.ManualRunStatus;
import me.golemcore.scheduler.domain.model.RunEntry;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Handle of a run started on demand. Completes with the recorded entry, or
 * with {@code null} when the run was cancelled.
 */
public final class ManualRun {

    private static final Pattern ANSI_ESCAPE = Pattern.compile("\u001B\\[[0-9;]*[a-zA-Z]");

    private final String id;
    private final String jobName;
    private final Instant startedAt;
    private final CompletableFuture<RunEntry> completion = new CompletableFuture<>();
    private final AtomicReference<ManualRunStatus> status = new AtomicReference<>(ManualRunStatus.RUNNING);
    private final AtomicReference<RunningCommand> command = new AtomicReference<>();
    private volatile String output = "";

    ManualRun(String id, String jobName, Instant startedAt) {
        this.id = id;
        this.jobName = jobName;
        this.startedAt = startedAt;
    }

    public String getId() {
        return id;
    }

    public String getJobName() {
        return jobName;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public ManualRunStatus getStatus() {
        return status.get();
    }

    /**
     * Standard output, followed by standard error under an
     * {@code --- ERROR ---} marker when the run failed. ANSI escapes are
     * removed.
     */
    public String getOutput() {
        return output;
    }

    public CompletableFuture<RunEntry> completion() {
        return completion;
    }

    /**
     * @return false when the run had already finished
     */
    public boolean cancel() {
        if (!status.compareAndSet(ManualRunStatus.RUNNING, ManualRunStatus.CANCELLED)) {
            return false;
        }
        RunningCommand running = command.get();
        if (running != null) {
            running.cancel();
        }
        return true;
    }

    boolean isCancelled() {
        return status.get() == ManualRunStatus.CANCELLED;
    }

    void attach(RunningCommand runningCommand) {
        command.set(runningCommand);
        if (isCancelled()) {
            runningCommand.cancel();
        }
    }

    /**
     * Record the final state unless the run was cancelled in the meantime.
     */
    boolean finish(ManualRunStatus finalStatus, String standardOutput, String standardError) {
        boolean failed = finalStatus == ManualRunStatus.FAILED;
        this.output = render(standardOutput, standardError, failed);
        return status.compareAndSet(ManualRunStatus.RUNNING, finalStatus);
    }

    void complete(RunEntry entry) {
        completion.complete(entry);
    }

    static String render(String standardOutput, String standardError, boolean showError) {
        String out = stripAnsi(standardOutput);
        String err = stripAnsi(standardError);
        if (!showError || err.isEmpty()) {
            return out;
        }
        return out + (out.isEmpty() ? "" : "\n\n--- ERROR ---\n") + err;
    }

    static String stripAnsi(String text) {
        if (text == null) {
            return "";
        }
        return ANSI_ESCAPE.matcher(text.strip()).replaceAll("");
    }
}
