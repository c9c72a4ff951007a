package com.templateformatter.util;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoggerUtilTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void restoreLevel() {
        LoggerUtil.setConsoleLevel(Level.WARNING);
    }

    @Test
    void testConsoleHandlerIsInstalled() {
        LoggerUtil.initialize();

        assertThat(Arrays.asList(Logger.getLogger("").getHandlers()))
                .anyMatch(handler -> handler instanceof ConsoleHandler);
    }

    @Test
    void testVerboseLevelReachesProjectLoggers() {
        LoggerUtil.setConsoleLevel(Level.FINE);

        assertThat(LoggerUtil.getConsoleLevel()).isEqualTo(Level.FINE);
        assertThat(Logger.getLogger(LoggerUtil.BASE_LOGGER).getLevel()).isEqualTo(Level.FINE);
        assertThat(LoggerUtil.getLogger(LoggerUtilTest.class).isLoggable(Level.FINE)).isTrue();
    }

    @Test
    void testFileLoggingRecordsMessages() throws IOException {
        Path logFile = tempDir.resolve("formatter.log");
        LoggerUtil.setConsoleLevel(Level.INFO);
        LoggerUtil.enableFileLogging(logFile);

        LoggerUtil.getLogger(LoggerUtilTest.class).info("formatted 3 templates");
        LoggerUtil.shutdown();

        assertThat(Files.readString(logFile)).contains("formatted 3 templates");
    }
}
