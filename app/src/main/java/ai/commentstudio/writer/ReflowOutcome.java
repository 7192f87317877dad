package ai.commentstudio.writer;

import java.util.List;

/**
 * Result of reflowing a whole document.
 *
 * @param lines         the document lines after every replacement
 * @param changedBlocks 0-based start lines (in the original document) of the blocks that changed
 */
public record ReflowOutcome(List<String> lines, List<Integer> changedBlocks) {

    public ReflowOutcome {
        lines = List.copyOf(lines);
        changedBlocks = List.copyOf(changedBlocks);
    }

    public boolean changed() {
        return !changedBlocks.isEmpty();
    }
}
