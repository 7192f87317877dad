package ai.commentstudio.tag;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * A tag keyword found at the start of comment content, with the metadata that followed it.
 *
 * @param tagName    tag as configured, not as written in the line
 * @param spanStart  offset of the keyword in the line
 * @param spanLength length of the keyword plus its metadata and colon
 * @param metadata   raw text inside the brackets
 * @param message    text after the tag up to the end of the comment
 */
public record TagMatch(
        String tagName,
        int spanStart,
        int spanLength,
        Optional<String> owner,
        Optional<Integer> issue,
        Optional<LocalDate> dueDate,
        Optional<String> anchorId,
        Optional<String> metadata,
        String message
) {

    public TagMatch {
        Objects.requireNonNull(tagName, "tagName");
        if (spanStart < 0 || spanLength < tagName.length()) {
            throw new IllegalArgumentException("invalid span");
        }
        owner = owner == null ? Optional.empty() : owner;
        issue = issue == null ? Optional.empty() : issue;
        dueDate = dueDate == null ? Optional.empty() : dueDate;
        anchorId = anchorId == null ? Optional.empty() : anchorId;
        metadata = metadata == null ? Optional.empty() : metadata;
        message = message == null ? "" : message;
    }

    public int spanEnd() {
        return spanStart + spanLength;
    }
}
