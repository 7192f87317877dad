package ai.commentstudio.scan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a document as an ordered line sequence with character offsets.
 * Every line break counts as a single character regardless of its original form.
 */
public final class LineBuffer {

    private final List<String> lines;
    private final int[] lineStarts;
    private final int length;

    private LineBuffer(List<String> lines) {
        this.lines = List.copyOf(lines);
        this.lineStarts = new int[this.lines.size()];
        int offset = 0;
        for (int i = 0; i < this.lines.size(); i++) {
            lineStarts[i] = offset;
            offset += this.lines.get(i).length() + 1;
        }
        this.length = this.lines.isEmpty() ? 0 : offset - 1;
    }

    public static LineBuffer of(List<String> lines) {
        Objects.requireNonNull(lines, "lines");
        return new LineBuffer(lines);
    }

    public static LineBuffer of(String text) {
        if (text == null || text.isEmpty()) {
            return new LineBuffer(Collections.emptyList());
        }
        List<String> lines = new ArrayList<>();
        int start = 0;
        int index = 0;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (ch == '\r' || ch == '\n') {
                lines.add(text.substring(start, index));
                if (ch == '\r' && index + 1 < text.length() && text.charAt(index + 1) == '\n') {
                    index++;
                }
                start = index + 1;
            }
            index++;
        }
        lines.add(text.substring(start));
        return new LineBuffer(lines);
    }

    public List<String> lines() {
        return lines;
    }

    public int lineCount() {
        return lines.size();
    }

    public int length() {
        return length;
    }

    public int lineStart(int lineNumber) {
        return lineStarts[lineNumber];
    }

    /**
     * Returns the 0-based line containing {@code offset}, or -1 when the offset lies outside the buffer.
     * The offset of a line break belongs to the line it terminates.
     */
    public int lineAt(int offset) {
        if (offset < 0 || offset > length || lines.isEmpty()) {
            return -1;
        }
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low;
    }
}
