package me.golemcore.scheduler.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.scheduler.domain.model.CommandResult;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Turns agent command templates into processes.
 *
 * <p>
 * A template such as {@code claude -p "{prompt}"} is tokenized first and the
 * prompt is substituted into each token afterwards, so quotes inside the
 * prompt never change how the command is split. The prompt itself may use
 * {@code {date}}, {@code {time}} and {@code {datetime}}, resolved against the
 * clock when the run starts.
 */
@Service
@Slf4j
public class AgentCommandService {

    public static final String PROMPT_PLACEHOLDER = "{prompt}";
    public static final String VALIDATION_PROMPT = "Hello";

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final List<String> ERROR_MARKERS = List.of(
            "error:", "failed:", "authentication failed", "api key not found", "command not found");
    private static final boolean WINDOWS = System.getProperty("os.name", "").toLowerCase(Locale.ROOT)
            .contains("win");

    private final Clock clock;
    private final ExecutorService outputReaders = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "agent-output");
        thread.setDaemon(true);
        return thread;
    });

    public AgentCommandService(Clock clock) {
        this.clock = clock;
    }

    public record ParsedCommand(String executable, List<String> arguments) {
    }

    public record ValidationResult(boolean success, String output, String error) {
    }

    public String resolvePlaceholders(String prompt) {
        return resolvePlaceholders(prompt, LocalDateTime.now(clock));
    }

    public String resolvePlaceholders(String prompt, LocalDateTime now) {
        if (prompt == null) {
            return "";
        }
        return prompt
                .replace("{date}", DATE.format(now))
                .replace("{time}", TIME.format(now))
                .replace("{datetime}", DATETIME.format(now));
    }

    /**
     * Command line as a user would read it, with the prompt and its
     * placeholders filled in.
     */
    public String substitutePrompt(String template, String prompt) {
        return template.replace(PROMPT_PLACEHOLDER, resolvePlaceholders(prompt));
    }

    /**
     * Split a command into executable and arguments. Double quotes group
     * whitespace; {@code \"} inside quotes is a literal quote.
     *
     * @throws IllegalArgumentException
     *             for an empty command or an unterminated quote
     */
    public ParsedCommand parseCommand(String command) {
        if (command == null || command.isBlank()) {
            throw new IllegalArgumentException("Command cannot be empty.");
        }
        List<String> tokens = tokenize(command.trim());
        return new ParsedCommand(tokens.get(0), tokens.subList(1, tokens.size()));
    }

    /**
     * Process command line for a template with an already resolved prompt.
     */
    public List<String> buildCommandLine(String template, String resolvedPrompt) {
        ParsedCommand parsed = parseCommand(template);
        List<String> commandLine = new ArrayList<>();
        commandLine.add(resolveExecutable(parsed.executable()));
        for (String argument : parsed.arguments()) {
            commandLine.add(argument.replace(PROMPT_PLACEHOLDER, resolvedPrompt));
        }
        return commandLine;
    }

    /**
     * Locate an executable on the PATH, trying PATHEXT extensions on Windows.
     * Unresolvable names are returned unchanged for the OS to try.
     */
    public String resolveExecutable(String executable) {
        Path direct = Paths.get(executable);
        if (direct.isAbsolute() && Files.isRegularFile(direct)) {
            return executable;
        }
        List<String> candidates = new ArrayList<>();
        if (WINDOWS && !hasExtension(executable)) {
            String pathExt = Optional.ofNullable(System.getenv("PATHEXT")).orElse(".COM;.EXE;.BAT;.CMD");
            for (String extension : pathExt.split(";")) {
                if (!extension.isBlank()) {
                    candidates.add(executable + extension);
                }
            }
        } else {
            candidates.add(executable);
        }
        for (String candidate : candidates) {
            Optional<Path> found = findInPath(candidate);
            if (found.isPresent()) {
                return found.get().toString();
            }
        }
        return executable;
    }

    public RunningCommand start(List<String> commandLine) throws IOException {
        log.debug("[Agent] Starting: {}", commandLine.get(0));
        Process process = new ProcessBuilder(commandLine).start();
        process.getOutputStream().close();
        return new RunningCommand(process, outputReaders);
    }

    public CommandResult execute(List<String> commandLine, Duration timeout)
            throws IOException, InterruptedException {
        return start(commandLine).await(timeout, timeoutMessage(timeout));
    }

    /**
     * Dry-run an agent template with a greeting prompt. A zero exit code still
     * fails validation when the output mentions a typical error.
     */
    public ValidationResult validate(String template, Duration timeout) {
        try {
            List<String> commandLine = buildCommandLine(template, resolvePlaceholders(VALIDATION_PROMPT));
            RunningCommand command = start(commandLine);
            CommandResult result = command.await(timeout,
                    "Validation timed out after " + timeout.toSeconds() + " seconds.");
            if (result.timedOut()) {
                return new ValidationResult(false, result.standardOutput(), result.standardError());
            }
            boolean success = result.exitCode() == 0 && !mentionsError(result);
            return new ValidationResult(success, result.standardOutput(), result.standardError());
        } catch (IOException | IllegalArgumentException e) {
            return new ValidationResult(false, "", "Failed to execute command: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new ValidationResult(false, "", "Validation interrupted.");
        }
    }

    public static String timeoutMessage(Duration timeout) {
        return "Error: Command timed out after " + timeout.toMinutes() + " minutes.";
    }

    private static boolean mentionsError(CommandResult result) {
        String combined = (result.standardOutput() + " " + result.standardError()).toLowerCase(Locale.ROOT);
        return ERROR_MARKERS.stream().anyMatch(combined::contains);
    }

    private static List<String> tokenize(String command) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuotes = false;
        boolean tokenStarted = false;
        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            if (inQuotes && c == '\\' && i + 1 < command.length() && command.charAt(i + 1) == '"') {
                current.append('"');
                i++;
            } else if (c == '"') {
                inQuotes = !inQuotes;
                tokenStarted = true;
            } else if (Character.isWhitespace(c) && !inQuotes) {
                if (tokenStarted) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    tokenStarted = false;
                }
            } else {
                current.append(c);
                tokenStarted = true;
            }
        }
        if (inQuotes) {
            throw new IllegalArgumentException("Unterminated quote in command.");
        }
        if (tokenStarted) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static boolean hasExtension(String executable) {
        Path fileName = Paths.get(executable).getFileName();
        return fileName != null && fileName.toString().lastIndexOf('.') > 0;
    }

    private static Optional<Path> findInPath(String fileName) {
        Path local = Paths.get(fileName);
        if (Files.isRegularFile(local) && local.getNameCount() > 1) {
            return Optional.of(local.toAbsolutePath());
        }
        String pathVariable = Optional.ofNullable(System.getenv("PATH")).orElse("");
        for (String dir : pathVariable.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path candidate = Paths.get(dir.trim()).resolve(fileName);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }
}
