package ai.commentstudio.writer;

import ai.commentstudio.reflow.ReflowConfig;
import ai.commentstudio.reflow.ReflowEngine;
import ai.commentstudio.scan.CommentBlock;
import ai.commentstudio.scan.CommentBlockScanner;
import ai.commentstudio.scan.DefaultCommentBlockScanner;
import ai.commentstudio.style.CommentStyle;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reflows every documentation comment of a document.
 */
public class DocumentReflower {

    private final CommentBlockScanner scanner;
    private final ReflowEngine engine;

    public DocumentReflower() {
        this(new DefaultCommentBlockScanner(), new ReflowEngine());
    }

    public DocumentReflower(CommentBlockScanner scanner, ReflowEngine engine) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public ReflowOutcome reflow(List<String> lines, CommentStyle style, ReflowConfig config) {
        Objects.requireNonNull(lines, "lines");
        Objects.requireNonNull(style, "style");
        Objects.requireNonNull(config, "config");

        List<CommentBlock> blocks = scanner.findAllBlocks(lines, style);
        List<String> result = new ArrayList<>(lines);
        List<Integer> changed = new ArrayList<>();
        // bottom-up so that earlier block positions stay valid
        for (int i = blocks.size() - 1; i >= 0; i--) {
            CommentBlock block = blocks.get(i);
            Optional<String> replacement = engine.reflow(block, config);
            if (replacement.isEmpty()) {
                continue;
            }
            List<String> range = result.subList(block.startLine(), block.endLine() + 1);
            range.clear();
            range.addAll(List.of(replacement.get().split("\n", -1)));
            changed.add(block.startLine());
        }
        Collections.reverse(changed);
        return new ReflowOutcome(result, changed);
    }
}
