package dev.markdown2pdf.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/**
 * Writes each log event as a single-line JSON object.
 *
 * <p>The MDC entry naming the Markdown input being converted is lifted to a top-level {@code source} field;
 * any other MDC entries go under {@code mdc}. A logged exception contributes its class and message.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    static final String SOURCE_KEY = "source";

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        JsonObject json = new JsonObject()
                .field("timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)))
                .field("level", event.getLevel().toString())
                .field("logger", event.getLoggerName())
                .field("message", event.getFormattedMessage());

        Map<String, String> mdc = new TreeMap<>(mdcOf(event));
        String source = mdc.remove(SOURCE_KEY);
        if (source != null) {
            json.field(SOURCE_KEY, source);
        }
        if (!mdc.isEmpty()) {
            JsonObject entries = new JsonObject();
            mdc.forEach(entries::field);
            json.object("mdc", entries);
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            json.object("exception", new JsonObject()
                    .field("class", throwable.getClassName())
                    .field("message", throwable.getMessage()));
        }
        return json + System.lineSeparator();
    }

    private static Map<String, String> mdcOf(ILoggingEvent event) {
        try {
            Map<String, String> map = event.getMDCPropertyMap();
            return map == null ? Map.of() : map;
        } catch (RuntimeException ex) {
            // events built outside a started logback context have no MDC adapter
            return Map.of();
        }
    }

    private static final class JsonObject {

        private final StringBuilder body = new StringBuilder(256);

        JsonObject field(String name, String value) {
            return raw(name, quote(value));
        }

        JsonObject object(String name, JsonObject value) {
            return raw(name, value.toString());
        }

        private JsonObject raw(String name, String json) {
            if (body.length() > 0) {
                body.append(',');
            }
            body.append(quote(name)).append(':').append(json);
            return this;
        }

        @Override
        public String toString() {
            return "{" + body + "}";
        }

        private static String quote(String value) {
            if (value == null) {
                return "null";
            }
            StringBuilder escaped = new StringBuilder(value.length() + 16);
            escaped.append('"');
            for (int i = 0; i < value.length(); i++) {
                char ch = value.charAt(i);
                switch (ch) {
                    case '\\' -> escaped.append("\\\\");
                    case '"' -> escaped.append("\\\"");
                    case '\n' -> escaped.append("\\n");
                    case '\r' -> escaped.append("\\r");
                    case '\t' -> escaped.append("\\t");
                    default -> {
                        if (ch < 0x20) {
                            escaped.append(String.format("\\u%04x", (int) ch));
                        } else {
                            escaped.append(ch);
                        }
                    }
                }
            }
            escaped.append('"');
            return escaped.toString();
        }
    }
}
