package ai.commentstudio.reflow;

/**
 * Formatting options applied when reflowing documentation comments.
 *
 * @param maxLineLength      maximum length of an output line, including indentation and comment marker
 * @param useCompactStyle    collapse short elements onto a single line
 * @param preserveBlankLines keep blank paragraph separators
 */
public record ReflowConfig(int maxLineLength, boolean useCompactStyle, boolean preserveBlankLines) {

    public static final int DEFAULT_MAX_LINE_LENGTH = 120;
    public static final ReflowConfig DEFAULT = new ReflowConfig(DEFAULT_MAX_LINE_LENGTH, true, true);

    public ReflowConfig {
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be at least 1");
        }
    }

    public ReflowConfig withMaxLineLength(int value) {
        return new ReflowConfig(value, useCompactStyle, preserveBlankLines);
    }
}
