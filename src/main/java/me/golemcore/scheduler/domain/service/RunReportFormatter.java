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

import me.golemcore.scheduler.domain.model.RunEntry;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Plain-text report of a single run, used by the run detail view and for
 * export.
 */
@Component
public class RunReportFormatter {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public RunReportFormatter(Clock clock) {
        this.clock = clock;
    }

    public String format(RunEntry entry) {
        String nl = System.lineSeparator();
        StringBuilder sb = new StringBuilder();
        sb.append("=== Job Run Started: ").append(timestamp(entry.getStartTime())).append(" ===").append(nl);
        sb.append("Job: ").append(nullToEmpty(entry.getJobName())).append(nl);
        sb.append("Prompt: ").append(nullToEmpty(entry.getPrompt())).append(nl);
        sb.append("Command: ").append(nullToEmpty(entry.getCommand())).append(nl);
        sb.append(nl);
        sb.append("--- STDOUT ---").append(nl);
        sb.append(nullToEmpty(entry.getStandardOutput())).append(nl);
        sb.append(nl);
        sb.append("--- STDERR ---").append(nl);
        sb.append(nullToEmpty(entry.getStandardError())).append(nl);
        sb.append(nl);
        sb.append("=== Job Run Completed: ").append(timestamp(entry.getEndTime())).append(" ===").append(nl);
        sb.append("Exit Code: ").append(entry.getExitCode()).append(nl);
        sb.append("Duration: ").append(String.format(Locale.ROOT, "%.1f", entry.getDurationSeconds())).append('s')
                .append(nl);
        sb.append("Status: ").append(entry.getStatus()).append(nl);
        return sb.toString();
    }

    private String timestamp(Instant instant) {
        if (instant == null) {
            return "";
        }
        return TIMESTAMP.format(instant.atZone(clock.getZone()));
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
