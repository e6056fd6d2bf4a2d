package org.messagewrangler.cli;

import ch.qos.logback.classic.Level;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LogLevelHighlightConverterTest {

    @Test
    void colorsErrorWarnAndInfo() {
        assertThat(LogLevelHighlightConverter.colorize(Level.ERROR, "ERROR"))
            .isEqualTo(LogLevelHighlightConverter.ANSI_RED + "ERROR" + LogLevelHighlightConverter.ANSI_RESET);
        assertThat(LogLevelHighlightConverter.colorize(Level.WARN, "WARN"))
            .isEqualTo(LogLevelHighlightConverter.ANSI_YELLOW + "WARN" + LogLevelHighlightConverter.ANSI_RESET);
        assertThat(LogLevelHighlightConverter.colorize(Level.INFO, "INFO"))
            .isEqualTo(LogLevelHighlightConverter.ANSI_BLUE + "INFO" + LogLevelHighlightConverter.ANSI_RESET);
    }

    @Test
    void leavesDebugAndTraceUncolored() {
        assertThat(LogLevelHighlightConverter.colorize(Level.DEBUG, "DEBUG")).isEqualTo("DEBUG");
        assertThat(LogLevelHighlightConverter.colorize(Level.TRACE, "TRACE")).isEqualTo("TRACE");
    }
}
