package ai.commentstudio.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * A text file split into lines, remembering the line separator and final newline it was read with.
 */
public record SourceDocument(Path path, List<String> lines, String lineSeparator, boolean trailingNewline) {

    public SourceDocument {
        Objects.requireNonNull(path, "path");
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        lineSeparator = lineSeparator == null || lineSeparator.isEmpty() ? "\n" : lineSeparator;
    }

    public static SourceDocument read(Path path) {
        try {
            return parse(path, Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read document: " + path, ex);
        }
    }

    static SourceDocument parse(Path path, String content) {
        String separator = content.contains("\r\n") ? "\r\n" : content.contains("\r") && !content.contains("\n") ? "\r" : "\n";
        boolean trailingNewline = content.endsWith("\n") || content.endsWith("\r");
        String body = trailingNewline ? content.substring(0, content.length() - (content.endsWith("\r\n") ? 2 : 1)) : content;
        List<String> lines = content.isEmpty() ? List.of() : List.of(body.split("\r\n|\r|\n", -1));
        return new SourceDocument(path, lines, separator, trailingNewline);
    }

    public SourceDocument withLines(List<String> replacement) {
        return new SourceDocument(path, replacement, lineSeparator, trailingNewline);
    }

    public String render() {
        String joined = String.join(lineSeparator, lines);
        return trailingNewline && !lines.isEmpty() ? joined + lineSeparator : joined;
    }
}
