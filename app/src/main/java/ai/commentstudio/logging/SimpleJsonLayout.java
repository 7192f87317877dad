package ai.commentstudio.logging;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.IThrowableProxy;
import ch.qos.logback.core.CoreConstants;
import ch.qos.logback.core.LayoutBase;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Writes each logging event as one JSON object per line.
 */
public class SimpleJsonLayout extends LayoutBase<ILoggingEvent> {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ISO_OFFSET_DATE_TIME;

    @Override
    public String doLayout(ILoggingEvent event) {
        StringBuilder builder = new StringBuilder(256).append('{');
        field(builder, "timestamp", TIMESTAMP.format(Instant.ofEpochMilli(event.getTimeStamp()).atOffset(ZoneOffset.UTC)));
        builder.append(',');
        field(builder, "level", event.getLevel().toString());
        builder.append(',');
        field(builder, "logger", event.getLoggerName());
        builder.append(',');
        field(builder, "message", event.getFormattedMessage());

        Map<String, String> mdc = mdc(event);
        if (!mdc.isEmpty()) {
            builder.append(",\"mdc\":{");
            boolean first = true;
            for (Map.Entry<String, String> entry : mdc.entrySet()) {
                if (!first) {
                    builder.append(',');
                }
                field(builder, entry.getKey(), entry.getValue());
                first = false;
            }
            builder.append('}');
        }

        IThrowableProxy throwable = event.getThrowableProxy();
        if (throwable != null) {
            builder.append(',');
            field(builder, "exception", throwable.getClassName() + ": " + throwable.getMessage());
        }
        return builder.append('}').append(CoreConstants.LINE_SEPARATOR).toString();
    }

    private static Map<String, String> mdc(ILoggingEvent event) {
        try {
            Map<String, String> map = event.getMDCPropertyMap();
            return map == null ? Map.of() : map;
        } catch (RuntimeException ex) {
            // events built outside a started logger context have no MDC adapter
            return Map.of();
        }
    }

    private static void field(StringBuilder builder, String name, String value) {
        quote(builder, name);
        builder.append(':');
        quote(builder, value);
    }

    /**
     * Appends {@code value} as a JSON string literal, or {@code null} when the value is missing.
     */
    public static void quote(StringBuilder builder, String value) {
        if (value == null) {
            builder.append("null");
            return;
        }
        builder.append('"');
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            switch (ch) {
                case '\\' -> builder.append("\\\\");
                case '"' -> builder.append("\\\"");
                case '\n' -> builder.append("\\n");
                case '\r' -> builder.append("\\r");
                case '\t' -> builder.append("\\t");
                default -> {
                    if (ch < 0x20) {
                        builder.append(String.format("\\u%04x", (int) ch));
                    } else {
                        builder.append(ch);
                    }
                }
            }
        }
        builder.append('"');
    }
}
