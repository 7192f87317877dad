package ai.commentstudio.tag;

import java.util.Objects;

/**
 * A tag match located in a document.
 *
 * @param lineNumber 1-based line of the match
 */
public record TagOccurrence(String filePath, int lineNumber, TagMatch match) {

    public TagOccurrence {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(match, "match");
        if (lineNumber < 1) {
            throw new IllegalArgumentException("lineNumber must be positive");
        }
    }

    public String fileName() {
        int slash = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
        return filePath.substring(slash + 1);
    }
}
