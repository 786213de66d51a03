package org.minimips.compiler.diagnostics;

import org.minimips.junit.extensions.logging.ExpectLog;
import org.minimips.junit.extensions.logging.FailOnLog;
import org.minimips.junit.extensions.logging.LogLevel;
import org.minimips.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class LoaderLoggerTest {

    @AfterEach
    void tearDown() {
        LoaderLogger.setLevel(LoaderLogger.INFO);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*LoaderLogger", messagePattern = "\\[WARNING\\] prog.s:3: odd directive")
    void reportsOnlyWarnings() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("prog.s");
        diagnostics.reportWarning("odd directive", 3);
        diagnostics.reportError("broken", 4);

        LoaderLogger.reportWarnings(diagnostics);

        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.summary()).isEqualTo("[WARNING] prog.s:3: odd directive\n[ERROR] prog.s:4: broken");
    }

    @Test
    void errorLevelSilencesWarnings() {
        LoaderLogger.setLevel(LoaderLogger.ERROR);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("prog.s");
        diagnostics.reportWarning("odd directive", 3);

        LoaderLogger.reportWarnings(diagnostics);

        assertThat(LoaderLogger.getLevel()).isEqualTo(LoaderLogger.ERROR);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    @FailOnLog(level = LogLevel.ERROR)
    void warningsPassWhenOnlyErrorsFail() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine("prog.s");
        diagnostics.reportWarning("tolerated directive", 1);

        LoaderLogger.reportWarnings(diagnostics);

        assertThat(diagnostics.getDiagnostics()).hasSize(1);
    }

    @Test
    void levelIsClamped() {
        LoaderLogger.setLevel(99);
        assertThat(LoaderLogger.getLevel()).isEqualTo(LoaderLogger.TRACE);
        LoaderLogger.setLevel(-3);
        assertThat(LoaderLogger.getLevel()).isEqualTo(LoaderLogger.ERROR);
    }
}
