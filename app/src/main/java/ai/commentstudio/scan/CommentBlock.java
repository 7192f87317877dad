package ai.commentstudio.scan;

import ai.commentstudio.style.CommentStyle;
import java.util.List;
import java.util.Objects;

/**
 * A maximal run of documentation comment lines.
 *
 * @param startLine    0-based index of the first line
 * @param endLine      0-based index of the last line, inclusive
 * @param rawLines     the lines exactly as they appear in the document
 * @param style        the language style the block was matched with
 * @param indentation  whitespace preceding the marker on the first line
 * @param blockComment {@code true} when delimited by the block opener and closer, {@code false} for a marker run
 */
public record CommentBlock(int startLine,
                           int endLine,
                           List<String> rawLines,
                           CommentStyle style,
                           String indentation,
                           boolean blockComment) {

    public CommentBlock {
        Objects.requireNonNull(style, "style");
        rawLines = List.copyOf(Objects.requireNonNull(rawLines, "rawLines"));
        indentation = indentation == null ? "" : indentation;
        if (startLine < 0 || endLine < startLine) {
            throw new IllegalArgumentException("Invalid comment block boundaries");
        }
        if (rawLines.size() != endLine - startLine + 1) {
            throw new IllegalArgumentException("rawLines must cover startLine..endLine");
        }
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    public boolean containsLine(int lineNumber) {
        return lineNumber >= startLine && lineNumber <= endLine;
    }
}
