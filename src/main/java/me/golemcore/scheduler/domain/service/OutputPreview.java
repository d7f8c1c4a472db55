package me.golemcore.scheduler.domain.service;

import java.util.Arrays;
import java.util.List;

/**
 * One-line preview of agent output for notifications.
 */
public final class OutputPreview {

    static final int MAX_LINES = 3;
    static final int MAX_LENGTH = 150;
    private static final String ELLIPSIS = "...";

    private OutputPreview() {
    }

    /**
     * Join the first three non-empty lines with spaces. Longer previews are
     * cut to 147 characters plus an ellipsis; an ellipsis is also appended
     * when lines were left out.
     *
     * @return the preview, or {@code null} for blank output
     */
    public static String of(String output) {
        if (output == null || output.isBlank()) {
            return null;
        }
        List<String> lines = Arrays.stream(output.split("\\r\\n|\\r|\\n"))
                .filter(line -> !line.isBlank())
                .toList();
        String preview = String.join(" ", lines.subList(0, Math.min(MAX_LINES, lines.size())));
        if (preview.length() > MAX_LENGTH) {
            return preview.substring(0, MAX_LENGTH - ELLIPSIS.length()) + ELLIPSIS;
        }
        if (lines.size() > MAX_LINES) {
            return preview + ELLIPSIS;
        }
        return preview;
    }
}
