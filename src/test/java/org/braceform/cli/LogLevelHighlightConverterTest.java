package org.braceform.cli;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void colorsByLevel() {
        assertThat(LogLevelHighlightConverter.colorOf(Level.ERROR)).isEqualTo("\u001B[31m");
        assertThat(LogLevelHighlightConverter.colorOf(Level.WARN)).isEqualTo("\u001B[33m");
        assertThat(LogLevelHighlightConverter.colorOf(Level.DEBUG))
            .isEqualTo(LogLevelHighlightConverter.colorOf(Level.TRACE));
        assertThat(LogLevelHighlightConverter.colorOf(Level.OFF)).isNull();
    }
}
