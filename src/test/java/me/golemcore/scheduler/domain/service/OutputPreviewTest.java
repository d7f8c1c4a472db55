package me.golemcore.scheduler.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class OutputPreviewTest {

    @Test
    void shouldReturnNullForBlankOutput() {
        assertNull(OutputPreview.of(null));
        assertNull(OutputPreview.of("  \n\r\n "));
    }

    @Test
    void shouldJoinUpToThreeNonBlankLines() {
        assertEquals("one two", OutputPreview.of("one\r\n\r\ntwo\n"));
        assertEquals("a b c", OutputPreview.of("a\nb\rc"));
    }

    @Test
    void shouldMarkDroppedLines() {
        assertEquals("a b c...", OutputPreview.of("a\nb\nc\nd"));
    }

    @Test
    void shouldTruncateLongPreview() {
        String preview = OutputPreview.of("x".repeat(200));

        assertEquals(150, preview.length());
        assertEquals("x".repeat(147) + "...", preview);
    }

    @Test
    void shouldKeepPreviewOfExactlyMaximumLength() {
        String line = "y".repeat(150);

        assertEquals(line, OutputPreview.of(line));
    }
}
