package ai.commentstudio.cli;

import ai.commentstudio.config.LogFormat;
import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;
import picocli.CommandLine;

/**
 * Converts {@code --log-format} values, listing the accepted formats when the value is unknown.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {

    static final String ACCEPTED = Arrays.stream(LogFormat.values())
            .map(format -> format.name().toLowerCase(Locale.ROOT))
            .collect(Collectors.joining(" or "));

    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException("expected " + ACCEPTED + " but was '" + value + "'");
        }
    }
}
