package dev.markdown2pdf.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import dev.markdown2pdf.config.LogFormat;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class LoggingConfiguratorTest {

    private final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
    private final Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);
    private final Level rootLevel = root.getLevel();
    private final Level pdfboxLevel = context.getLogger(LoggingConfigurator.PDFBOX_LOGGER).getLevel();

    @AfterEach
    void restoreLevels() {
        root.setLevel(rootLevel);
        context.getLogger(LoggingConfigurator.PDFBOX_LOGGER).setLevel(pdfboxLevel);
        LoggingConfigurator.configure(LogFormat.TEXT, false);
    }

    @Test
    void verboseLowersRootLevelButNotPdfbox() {
        LoggingConfigurator.configure(LogFormat.JSON, true);

        assertThat(root.getLevel()).isEqualTo(Level.DEBUG);
        assertThat(context.getLogger(LoggingConfigurator.PDFBOX_LOGGER).getEffectiveLevel()).isEqualTo(Level.WARN);
    }

    @Test
    void quietModeKeepsConfiguredLevel() {
        LoggingConfigurator.configure(LogFormat.TEXT, false);

        assertThat(root.getLevel()).isEqualTo(rootLevel);
    }
}
