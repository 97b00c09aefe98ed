package com.phillippitts.affectsignal.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void truncateHandlesNullAndLimits() {
        assertThat(LogSanitizer.truncate(null, 10)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 0)).isEmpty();
        assertThat(LogSanitizer.truncate("abc", 10)).isEqualTo("abc");
        assertThat(LogSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
    }

    @Test
    void previewCollapsesLineBreaks() {
        assertThat(LogSanitizer.preview("{\"error\":\r\n\"unauthorized\"}\n"))
                .isEqualTo("{\"error\": \"unauthorized\"} ");
    }

    @Test
    void previewCapsLength() {
        assertThat(LogSanitizer.preview("x".repeat(500))).hasSize(LogSanitizer.BODY_PREVIEW);
    }
}
