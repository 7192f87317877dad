package ai.commentstudio.scan;

import ai.commentstudio.style.CommentStyle;
import java.util.List;
import java.util.Optional;

/**
 * Locates documentation comment blocks in a line sequence.
 */
public interface CommentBlockScanner {

    List<CommentBlock> findAllBlocks(List<String> lines, CommentStyle style);

    /**
     * Resolves the style from an editor content type first; unknown content types yield no blocks.
     */
    List<CommentBlock> findAllBlocks(List<String> lines, String contentType);

    Optional<CommentBlock> findBlockAtPosition(LineBuffer buffer, CommentStyle style, int offset);
}
