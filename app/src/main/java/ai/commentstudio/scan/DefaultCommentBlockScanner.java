package ai.commentstudio.scan;

import ai.commentstudio.style.CommentStyle;
import ai.commentstudio.style.CommentStyleCatalog;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single forward pass grouping consecutive documentation comment lines into blocks.
 */
public class DefaultCommentBlockScanner implements CommentBlockScanner {

    private static final String EMPTY_BLOCK_COMMENT = "/**/";

    @Override
    public List<CommentBlock> findAllBlocks(List<String> lines, CommentStyle style) {
        Objects.requireNonNull(style, "style");
        if (lines == null || lines.isEmpty()) {
            return Collections.emptyList();
        }

        List<CommentBlock> blocks = new ArrayList<>();
        int index = 0;
        while (index < lines.size()) {
            String line = lines.get(index);
            int indent = leadingWhitespace(line);
            if (line.startsWith(style.lineMarker(), indent)) {
                int start = index;
                index++;
                while (index < lines.size() && isMarkerLine(lines.get(index), style)) {
                    index++;
                }
                blocks.add(newBlock(lines, start, index - 1, style, line.substring(0, indent), false));
            } else if (opensBlockComment(line, indent, style)) {
                int start = index;
                int end = findBlockEnd(lines, start, indent, style);
                blocks.add(newBlock(lines, start, end, style, line.substring(0, indent), true));
                index = end + 1;
            } else {
                index++;
            }
        }
        return blocks;
    }

    @Override
    public List<CommentBlock> findAllBlocks(List<String> lines, String contentType) {
        return CommentStyleCatalog.forContentType(contentType)
                .map(style -> findAllBlocks(lines, style))
                .orElse(Collections.emptyList());
    }

    @Override
    public Optional<CommentBlock> findBlockAtPosition(LineBuffer buffer, CommentStyle style, int offset) {
        Objects.requireNonNull(buffer, "buffer");
        int lineNumber = buffer.lineAt(offset);
        if (lineNumber < 0) {
            return Optional.empty();
        }
        for (CommentBlock block : findAllBlocks(buffer.lines(), style)) {
            if (block.containsLine(lineNumber)) {
                return Optional.of(block);
            }
            if (block.startLine() > lineNumber) {
                break;
            }
        }
        return Optional.empty();
    }

    private boolean isMarkerLine(String line, CommentStyle style) {
        return line.startsWith(style.lineMarker(), leadingWhitespace(line));
    }

    private boolean opensBlockComment(String line, int indent, CommentStyle style) {
        return style.supportsBlockComments()
                && line.startsWith(style.blockOpen(), indent)
                && !line.startsWith(EMPTY_BLOCK_COMMENT, indent);
    }

    /**
     * Returns the line holding the closer, or the last line when the comment is never closed.
     */
    private int findBlockEnd(List<String> lines, int start, int indent, CommentStyle style) {
        String first = lines.get(start);
        if (first.indexOf(style.blockClose(), indent + style.blockOpen().length()) >= 0) {
            return start;
        }
        for (int i = start + 1; i < lines.size(); i++) {
            if (lines.get(i).contains(style.blockClose())) {
                return i;
            }
        }
        return lines.size() - 1;
    }

    private CommentBlock newBlock(List<String> lines, int start, int end, CommentStyle style,
                                  String indentation, boolean blockComment) {
        return new CommentBlock(start, end, lines.subList(start, end + 1), style, indentation, blockComment);
    }

    static int leadingWhitespace(String line) {
        int index = 0;
        while (index < line.length() && Character.isWhitespace(line.charAt(index))) {
            index++;
        }
        return index;
    }
}
