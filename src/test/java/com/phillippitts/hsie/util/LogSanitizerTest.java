package com.phillippitts.hsie.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void shouldReturnEmptyStringForNullOrNonPositiveMax() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("hello world", -1)).isEmpty();
    }

    @Test
    void shouldTruncateWhenLongerThanMax() {
        assertThat(LogSanitizer.truncate("hello world", 5)).isEqualTo("hello");
        assertThat(LogSanitizer.truncate("hello", 5)).isEqualTo("hello");
    }

    @Test
    void previewShowsShortTextWithLength() {
        assertThat(LogSanitizer.preview("good morning")).isEqualTo("\"good morning\" (12 chars)");
    }

    @Test
    void previewCutsLongTextAndFlattensNewlines() {
        String text = "line one\n" + "x".repeat(60);

        String preview = LogSanitizer.preview(text);

        assertThat(preview).startsWith("\"line one x").endsWith("…\" (69 chars)");
        assertThat(preview).doesNotContain("\n");
    }

    @Test
    void previewOfNullIsPlaceholder() {
        assertThat(LogSanitizer.preview(null)).isEqualTo("<none>");
    }
}
