package com.phillippitts.holderbot.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LogSanitizerTest {

    @Test
    void previewFlattensAndMarksCut() {
        assertThat(LogSanitizer.preview("smooth\nround pole", 100)).isEqualTo("smooth round pole");
        assertThat(LogSanitizer.preview("galvanized steel shaft", 10)).isEqualTo("galvanized...");
        assertThat(LogSanitizer.preview(null, 10)).isEmpty();
        assertThat(LogSanitizer.preview("pole", 0)).isEmpty();
        assertThat(LogSanitizer.preview("pole", 4)).isEqualTo("pole");
    }
}
