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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Command-line agents with a known invocation, and display names derived from
 * agent commands.
 */
public final class AgentCatalog {

    public record Agent(String name, String command) {

        String executable() {
            return firstToken(command).toLowerCase(Locale.ROOT);
        }
    }

    public static final List<Agent> PREDEFINED = List.of(
            new Agent("Claude", "claude -p \"{prompt}\" --dangerously-skip-permissions"),
            new Agent("Codex", "codex exec \"{prompt}\" --yolo"),
            new Agent("Gemini CLI", "gemini -p \"{prompt}\" --approval-mode=yolo"),
            new Agent("OpenCode", "opencode run \"{prompt}\""),
            new Agent("Qwen Code", "qwen -p \"{prompt}\" --approval-mode yolo"));

    private AgentCatalog() {
    }

    /**
     * Display name for the agent a command invokes: the catalogue name when
     * the executable is known, otherwise the capitalized executable name.
     */
    public static String agentName(String command) {
        if (command == null || command.isBlank()) {
            return "Unknown";
        }
        String firstPart = firstToken(command);
        String executable = firstPart.toLowerCase(Locale.ROOT);
        for (Agent agent : PREDEFINED) {
            if (agent.executable().equals(executable)) {
                return agent.name();
            }
        }
        try {
            Path fileName = Paths.get(firstPart.replace("\"", "")).getFileName();
            String baseName = fileName != null ? stripExtension(fileName.toString()) : "";
            if (baseName.isEmpty()) {
                return "Custom";
            }
            return Character.toUpperCase(baseName.charAt(0)) + baseName.substring(1).toLowerCase(Locale.ROOT);
        } catch (RuntimeException e) {
            return "Custom";
        }
    }

    private static String firstToken(String command) {
        String trimmed = command.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
