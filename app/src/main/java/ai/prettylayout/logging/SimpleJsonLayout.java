package ai.prettylayout.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.TreeMap;

/**
 * Renders each logging event as a single-line JSON object: timestamp, level, logger, thread, message, the
 * MDC entries (sorted by key) and, when present, the exception class and message.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        JsonLine line = new JsonLine();
        line.field("timestamp", TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        line.field("level", String.valueOf(event.getLevel()));
        line.field("logger", event.getLoggerName());
        line.field("thread", event.getThreadName());
        line.field("message", event.getFormattedMessage());
        Map<String, String> mdc = event.getMDCPropertyMap();
        if (mdc != null && !mdc.isEmpty()) {
            line.object("mdc", new TreeMap<>(mdc));
        }
        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            line.field("exception", throwable.getClassName());
            line.field("exceptionMessage", throwable.getMessage());
        }
        return line.close() + System.lineSeparator();
    }

    private static final class JsonLine {
        private final StringBuilder json = new StringBuilder(256).append('{');
        private boolean first = true;

        void field(String name, String value) {
            separator();
            quote(name);
            json.append(':');
            quote(value);
        }

        void object(String name, Map<String, String> values) {
            separator();
            quote(name);
            json.append(":{");
            boolean firstEntry = true;
            for (Map.Entry<String, String> entry : values.entrySet()) {
                if (!firstEntry) {
                    json.append(',');
                }
                firstEntry = false;
                quote(entry.getKey());
                json.append(':');
                quote(entry.getValue());
            }
            json.append('}');
        }

        String close() {
            return json.append('}').toString();
        }

        private void separator() {
            if (!first) {
                json.append(',');
            }
            first = false;
        }

        private void quote(String value) {
            if (value == null) {
                json.append("null");
                return;
            }
            json.append('"');
            for (int i = 0; i < value.length(); i++) {
                char ch = value.charAt(i);
                switch (ch) {
                    case '"' -> json.append("\\\"");
                    case '\\' -> json.append("\\\\");
                    case '\n' -> json.append("\\n");
                    case '\r' -> json.append("\\r");
                    case '\t' -> json.append("\\t");
                    default -> {
                        if (ch < 0x20) {
                            json.append(String.format("\\u%04x", (int) ch));
                        } else {
                            json.append(ch);
                        }
                    }
                }
            }
            json.append('"');
        }
    }
}
