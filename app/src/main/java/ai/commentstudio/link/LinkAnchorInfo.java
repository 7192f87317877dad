package ai.commentstudio.link;

import java.util.Optional;

/**
 * One {@code LINK:} reference located in a line of text.
 *
 * @param spanStart     offset of the {@code LINK} keyword
 * @param spanLength    length from the keyword to the end of the target
 * @param targetStart   offset of the path or anchor that follows the keyword
 * @param targetLength  length of the target text
 * @param filePath      referenced file; empty for local anchors
 * @param localAnchor   whether the reference points at an anchor in the current file
 * @param anchorName    anchor name without the leading {@code #}
 * @param lineNumber    1-based start line
 * @param endLineNumber 1-based end line, always greater than {@code lineNumber}
 */
public record LinkAnchorInfo(
        int spanStart,
        int spanLength,
        int targetStart,
        int targetLength,
        Optional<String> filePath,
        boolean localAnchor,
        Optional<String> anchorName,
        Optional<Integer> lineNumber,
        Optional<Integer> endLineNumber
) {

    public LinkAnchorInfo {
        if (spanStart < 0 || spanLength < 0 || targetStart < spanStart || targetLength < 0) {
            throw new IllegalArgumentException("invalid span");
        }
        filePath = filePath == null ? Optional.empty() : filePath;
        anchorName = anchorName == null ? Optional.empty() : anchorName;
        lineNumber = lineNumber == null ? Optional.empty() : lineNumber;
        endLineNumber = endLineNumber == null ? Optional.empty() : endLineNumber;
        if (localAnchor && filePath.isPresent()) {
            throw new IllegalArgumentException("local anchors carry no file path");
        }
        if (endLineNumber.isPresent() && lineNumber.isEmpty()) {
            throw new IllegalArgumentException("endLineNumber requires lineNumber");
        }
    }

    public int targetEnd() {
        return targetStart + targetLength;
    }

    public boolean hasLineRange() {
        return endLineNumber.isPresent();
    }

    /**
     * Rebuilds the target text in {@code path[:line[-endLine]][#anchor]} form.
     */
    public String describeTarget() {
        StringBuilder builder = new StringBuilder(filePath.orElse(""));
        lineNumber.ifPresent(line -> builder.append(':').append(line));
        endLineNumber.ifPresent(end -> builder.append('-').append(end));
        anchorName.ifPresent(anchor -> builder.append('#').append(anchor));
        return builder.toString();
    }
}
