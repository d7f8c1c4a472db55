package me.golemcore.scheduler.domain.service;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Arguments of a detached job run.
 *
 * <pre>
 * --run-job &lt;name&gt; --command &lt;template&gt; --prompt &lt;prompt&gt; --logs &lt;dir&gt;
 * --run-job &lt;name&gt; &lt;base64 template&gt; &lt;base64 prompt&gt; &lt;dir&gt;
 * </pre>
 *
 * The host scheduler is always given the base64 form so that quotes and
 * newlines in prompts survive argument quoting.
 */
@Slf4j
public record JobRunArguments(String jobName, String command, String prompt, String logsDirectory) {

    public static final String RUN_JOB_FLAG = "--run-job";

    private static final String COMMAND_FLAG = "--command";
    private static final String PROMPT_FLAG = "--prompt";
    private static final String LOGS_FLAG = "--logs";
    private static final int POSITIONAL_COUNT = 5;

    public static boolean isRunJobInvocation(String[] args) {
        return args != null && args.length > 0 && RUN_JOB_FLAG.equals(args[0]);
    }

    /**
     * Parse runner arguments. Empty when no job name or command could be
     * recovered.
     */
    public static Optional<JobRunArguments> parse(String[] args) {
        if (!isRunJobInvocation(args) || args.length < 2) {
            return Optional.empty();
        }
        String jobName = args[1];
        String command = "";
        String prompt = "";
        String logs = "";
        for (int i = 2; i < args.length; i++) {
            if (COMMAND_FLAG.equals(args[i]) && i + 1 < args.length) {
                command = args[++i];
            } else if (PROMPT_FLAG.equals(args[i]) && i + 1 < args.length) {
                prompt = args[++i];
            } else if (LOGS_FLAG.equals(args[i]) && i + 1 < args.length) {
                logs = args[++i];
            }
        }

        if ((command.isEmpty() || prompt.isEmpty()) && args.length >= POSITIONAL_COUNT) {
            try {
                String decodedCommand = decode(args[2]);
                String decodedPrompt = decode(args[3]);
                command = decodedCommand;
                prompt = decodedPrompt;
                logs = args[4];
            } catch (IllegalArgumentException e) {
                // Not the base64 form: keep whatever the flags provided.
                log.debug("[JobRunner] Arguments are not base64 encoded, using flag values: {}", e.getMessage());
            }
        }

        if (jobName.isBlank() || command.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new JobRunArguments(jobName, command, prompt, logs));
    }

    /**
     * Arguments in the base64 form, without the launcher prefix.
     */
    public List<String> toArguments() {
        List<String> arguments = new ArrayList<>();
        arguments.add(RUN_JOB_FLAG);
        arguments.add(jobName);
        arguments.add(encode(command));
        arguments.add(encode(prompt));
        arguments.add(logsDirectory);
        return arguments;
    }

    private static String encode(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }

    private static String decode(String value) {
        return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
    }
}
