package dev.markdown2pdf.logging;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.LoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import java.util.Map;
import org.junit.jupiter.api.Test;

class SimpleJsonLayoutTest {

    @Test
    void formatsEventAsJson() {
        LoggerContext context = new LoggerContext();
        context.start();
        SimpleJsonLayout layout = layout(context);
        LoggingEvent event = event(context, "Saved PDF to \"out.pdf\"");

        String json = layout.doLayout(event);

        assertThat(json).startsWith("{\"timestamp\":\"1970-01-01T00:00:00Z\"");
        assertThat(json).contains("\"message\":\"Saved PDF to \\\"out.pdf\\\"\"");
        assertThat(json).contains("\"logger\":\"dev.markdown2pdf.cli.CliApplication\"");
        assertThat(json).contains("\"level\":\"INFO\"");
        assertThat(json).doesNotContain("\"mdc\"", "\"source\"", "\"exception\"");
        assertThat(json).endsWith("}" + System.lineSeparator());
    }

    @Test
    void liftsSourceAndNestsOtherMdcEntries() {
        LoggerContext context = new LoggerContext();
        context.start();
        LoggingEvent event = event(context, "converting");
        event.setMDCPropertyMap(Map.of(SimpleJsonLayout.SOURCE_KEY, "file notes.md", "run", "7"));

        String json = layout(context).doLayout(event);

        assertThat(json).contains("\"source\":\"file notes.md\"");
        assertThat(json).contains("\"mdc\":{\"run\":\"7\"}");
    }

    @Test
    void includesExceptionClassAndMessage() {
        LoggerContext context = new LoggerContext();
        context.start();
        LoggingEvent event = event(context, "Internal error");
        event.setThrowableProxy(new ThrowableProxy(new IllegalStateException("line\nbreak")));

        String json = layout(context).doLayout(event);

        assertThat(json).contains(
                "\"exception\":{\"class\":\"java.lang.IllegalStateException\",\"message\":\"line\\nbreak\"}");
    }

    private static SimpleJsonLayout layout(LoggerContext context) {
        SimpleJsonLayout layout = new SimpleJsonLayout();
        layout.setContext(context);
        layout.start();
        return layout;
    }

    private static LoggingEvent event(LoggerContext context, String message) {
        LoggingEvent event = new LoggingEvent();
        event.setLevel(Level.INFO);
        event.setLoggerName("dev.markdown2pdf.cli.CliApplication");
        event.setMessage(message);
        event.setThreadName("main");
        event.setTimeStamp(0L);
        event.setLoggerContext(context);
        return event;
    }
}
