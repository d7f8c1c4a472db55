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
import me.golemcore.scheduler.domain.model.Job;
import me.golemcore.scheduler.domain.model.JobMetadata;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;
import java.util.Optional;

/**
 * Encodes job identity into the single free-text description field of a host
 * task.
 *
 * <pre>
 * GolemCore Job v1
 * SILENT:false
 * PROMPT:&lt;base64&gt;
 * AGENT:&lt;base64&gt;     (optional)
 * COLOR:#3366ff       (optional)
 * ICON:rocket         (optional)
 * </pre>
 *
 * Descriptions that do not decode belong to somebody else and are ignored.
 */
@Component
@Slf4j
public class JobMetadataCodec {

    public static final String HEADER = "GolemCore Job v1";

    private static final String SILENT = "SILENT:";
    private static final String PROMPT = "PROMPT:";
    private static final String AGENT = "AGENT:";
    private static final String COLOR = "COLOR:";
    private static final String ICON = "ICON:";
    private static final int MIN_LINES = 3;

    public String encode(Job job) {
        StringBuilder sb = new StringBuilder(HEADER)
                .append('\n').append(SILENT).append(job.isSilent())
                .append('\n').append(PROMPT).append(toBase64(job.getPrompt()));
        if (isPresent(job.getAgentOverride())) {
            sb.append('\n').append(AGENT).append(toBase64(job.getAgentOverride()));
        }
        if (isPresent(job.getHexColor())) {
            sb.append('\n').append(COLOR).append(job.getHexColor());
        }
        if (isPresent(job.getIcon())) {
            sb.append('\n').append(ICON).append(job.getIcon());
        }
        return sb.toString();
    }

    public Optional<JobMetadata> decode(String description) {
        if (description == null || description.isBlank()) {
            return Optional.empty();
        }
        String[] lines = description.split("\n", -1);
        if (lines.length < MIN_LINES || !HEADER.equals(lines[0].trim())) {
            return Optional.empty();
        }

        boolean silent = false;
        String prompt = null;
        String agentOverride = null;
        String hexColor = null;
        String icon = null;

        for (int i = 1; i < lines.length; i++) {
            String line = lines[i].trim();
            if (startsWithKey(line, SILENT)) {
                silent = "true".equalsIgnoreCase(valueOf(line, SILENT));
            } else if (startsWithKey(line, PROMPT)) {
                prompt = fromBase64(valueOf(line, PROMPT));
                if (prompt == null) {
                    return Optional.empty();
                }
            } else if (startsWithKey(line, AGENT)) {
                agentOverride = fromBase64(valueOf(line, AGENT));
            } else if (startsWithKey(line, COLOR)) {
                hexColor = valueOf(line, COLOR);
            } else if (startsWithKey(line, ICON)) {
                icon = valueOf(line, ICON);
            }
        }

        if (prompt == null || prompt.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new JobMetadata(prompt, silent, agentOverride, hexColor, icon));
    }

    /**
     * Cheap ownership test that does not decode the payload.
     */
    public boolean isManagedTask(String description) {
        return description != null && !description.isBlank() && description.stripLeading().startsWith(HEADER);
    }

    private static boolean startsWithKey(String line, String key) {
        return line.toUpperCase(Locale.ROOT).startsWith(key);
    }

    private static String valueOf(String line, String key) {
        return line.substring(key.length()).trim();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

    private static String toBase64(String value) {
        String text = value != null ? value : "";
        return Base64.getEncoder().encodeToString(text.getBytes(StandardCharsets.UTF_8));
    }

    private static String fromBase64(String value) {
        try {
            return new String(Base64.getDecoder().decode(value), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("[Metadata] Malformed base64 field: {}", e.getMessage());
            return null;
        }
    }
}
