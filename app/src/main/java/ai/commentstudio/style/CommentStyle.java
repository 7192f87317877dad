package ai.commentstudio.style;

import java.util.Objects;

/**
 * Documentation comment delimiters of a single language.
 */
public record CommentStyle(String languageId, String lineMarker, String blockOpen, String blockClose) {

    public CommentStyle {
        languageId = requireNonBlank(languageId, "languageId");
        lineMarker = requireNonBlank(lineMarker, "lineMarker");
        if ((blockOpen == null) != (blockClose == null)) {
            throw new IllegalArgumentException("blockOpen and blockClose must be provided together");
        }
    }

    public static CommentStyle lineOnly(String languageId, String lineMarker) {
        return new CommentStyle(languageId, lineMarker, null, null);
    }

    public boolean supportsBlockComments() {
        return blockOpen != null;
    }

    private static String requireNonBlank(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return value;
    }
}
