package ai.commentstudio.config;

import ai.commentstudio.export.ExportFormat;
import ai.commentstudio.reflow.ReflowConfig;
import ai.commentstudio.style.CommentStyle;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 *
 * @param style forced comment style; when empty the style is chosen from each file's extension
 */
public record Config(
        Command command,
        List<Path> files,
        ReflowConfig reflowConfig,
        List<String> customTags,
        ExportFormat exportFormat,
        boolean write,
        LogFormat logFormat,
        Optional<CommentStyle> style,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(command, "command");
        files = List.copyOf(Objects.requireNonNull(files, "files"));
        if (files.isEmpty()) {
            throw new IllegalArgumentException("At least one file must be provided");
        }
        Objects.requireNonNull(reflowConfig, "reflowConfig");
        customTags = customTags == null ? List.of() : List.copyOf(customTags);
        exportFormat = exportFormat == null ? ExportFormat.TSV : exportFormat;
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        style = style == null ? Optional.empty() : style;
        if (write && command != Command.REFLOW) {
            throw new IllegalArgumentException("--write can only be used with the reflow command");
        }
    }
}
