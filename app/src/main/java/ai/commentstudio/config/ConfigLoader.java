package ai.commentstudio.config;

import ai.commentstudio.cli.CliArguments;
import ai.commentstudio.export.ExportFormat;
import ai.commentstudio.reflow.ReflowConfig;
import ai.commentstudio.style.CommentStyle;
import ai.commentstudio.style.CommentStyleCatalog;
import ai.commentstudio.tag.TagKeywords;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * Command-line values win over the environment.
 */
public class ConfigLoader {

    static final String ENV_MAX_LINE_LENGTH = "COMMENT_MAX_LINE_LENGTH";
    static final String ENV_COMPACT_STYLE = "COMMENT_COMPACT_STYLE";
    static final String ENV_PRESERVE_BLANK_LINES = "COMMENT_PRESERVE_BLANK_LINES";
    static final String ENV_CUSTOM_TAGS = "COMMENT_CUSTOM_TAGS";
    static final String ENV_EXPORT_FORMAT = "COMMENT_EXPORT_FORMAT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.command() == null) {
            throw new IllegalArgumentException("Command must be provided");
        }

        int maxLineLength = resolveMaxLineLength(arguments);
        boolean compact = resolveFlag(arguments.compact(), ENV_COMPACT_STYLE, true);
        boolean preserveBlankLines = resolveFlag(arguments.preserveBlankLines(), ENV_PRESERVE_BLANK_LINES, true);
        ReflowConfig reflowConfig = new ReflowConfig(maxLineLength, compact, preserveBlankLines);

        List<String> customTags = TagKeywords.parseList(Optional.ofNullable(arguments.customTags())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.value(ENV_CUSTOM_TAGS))
                .orElse(""));

        ExportFormat exportFormat = Optional.ofNullable(arguments.exportFormat())
                .or(() -> environmentReader.value(ENV_EXPORT_FORMAT).map(ExportFormat::from))
                .orElse(ExportFormat.TSV);

        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .or(() -> environmentReader.value(ENV_LOG_FORMAT).map(LogFormat::from))
                .orElse(LogFormat.TEXT);

        Optional<CommentStyle> style = resolveStyle(arguments.language());

        return new Config(arguments.command(), arguments.files(), reflowConfig, customTags, exportFormat,
                arguments.write(), logFormat, style, arguments.verbose());
    }

    private int resolveMaxLineLength(CliArguments arguments) {
        Integer cliValue = arguments.maxLineLength();
        if (cliValue != null) {
            return requirePositive(cliValue, "--max-line-length");
        }
        return environmentReader.value(ENV_MAX_LINE_LENGTH)
                .map(ConfigLoader::parseInteger)
                .map(value -> requirePositive(value, ENV_MAX_LINE_LENGTH))
                .orElse(ReflowConfig.DEFAULT_MAX_LINE_LENGTH);
    }

    private boolean resolveFlag(Boolean cliValue, String envKey, boolean defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.value(envKey)
                .map(value -> parseFlag(envKey, value))
                .orElse(defaultValue);
    }

    private static Optional<CommentStyle> resolveStyle(String language) {
        if (!isNotBlank(language)) {
            return Optional.empty();
        }
        return Optional.of(CommentStyleCatalog.forLanguageId(language)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported language: " + language)));
    }

    private static boolean parseFlag(String key, String raw) {
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new IllegalArgumentException(key + " must be true or false: " + raw);
        };
    }

    private static int parseInteger(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_MAX_LINE_LENGTH + " must be an integer", ex);
        }
    }

    private static int requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be at least 1");
        }
        return value;
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
