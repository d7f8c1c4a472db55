package me.golemcore.scheduler.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.CommandResult;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An agent process whose output is being captured line by line. Killing it
 * takes the whole process tree down.
 */
@Slf4j
public final class RunningCommand {

    private static final Duration DRAIN_WAIT = Duration.ofSeconds(5);

    private final Process process;
    private final OutputCollector stdout;
    private final OutputCollector stderr;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    RunningCommand(Process process, Executor readerExecutor) {
        this.process = process;
        this.stdout = new OutputCollector(process.getInputStream(), readerExecutor);
        this.stderr = new OutputCollector(process.getErrorStream(), readerExecutor);
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Wait for the process to exit. On timeout the process tree is killed and
     * the result carries exit code -1 and {@code timeoutMessage} appended to
     * standard error.
     */
    public CommandResult await(Duration timeout, String timeoutMessage) throws InterruptedException {
        boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!finished) {
            log.warn("[Agent] Process {} exceeded {}, killing", process.pid(), timeout);
            destroyTree();
            process.waitFor(DRAIN_WAIT.toMillis(), TimeUnit.MILLISECONDS);
            String error = appendLine(stderr.text(DRAIN_WAIT), timeoutMessage);
            return new CommandResult(-1, stdout.text(DRAIN_WAIT), error, true, cancelled.get());
        }
        return new CommandResult(process.exitValue(), stdout.text(DRAIN_WAIT), stderr.text(DRAIN_WAIT), false,
                cancelled.get());
    }

    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("[Agent] Cancelling process {}", process.pid());
            destroyTree();
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private void destroyTree() {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static String appendLine(String text, String line) {
        return text.isEmpty() ? line : text + System.lineSeparator() + line;
    }

    private static final class OutputCollector {

        private final StringBuffer buffer = new StringBuffer();
        private final CompletableFuture<Void> done;

        OutputCollector(InputStream stream, Executor executor) {
            this.done = CompletableFuture.runAsync(() -> drain(stream), executor);
        }

        private void drain(InputStream stream) {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    buffer.append(line).append(System.lineSeparator());
                }
            } catch (IOException e) {
                log.debug("[Agent] Output stream closed: {}", e.getMessage());
            }
        }

        /**
         * Captured text, trimmed. Waits briefly for the reader to reach the
         * end of the stream; descendants that inherited the pipe may keep it
         * open, in which case whatever was read so far is returned.
         */
        String text(Duration wait) throws InterruptedException {
            try {
                done.get(wait.toMillis(), TimeUnit.MILLISECONDS);
            } catch (ExecutionException | TimeoutException e) {
                log.debug("[Agent] Output not fully drained: {}", e.toString());
            }
            return buffer.toString().strip();
        }
    }
}
