package ai.commentstudio.reflow;

import ai.commentstudio.scan.CommentBlock;
import ai.commentstudio.xml.XmlDocParser;
import ai.commentstudio.xml.XmlNode;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewraps documentation comment blocks to a maximum line length while keeping their markup intact.
 */
public class ReflowEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReflowEngine.class);
    private static final String CONTINUATION = " * ";

    private final XmlDocParser parser;

    public ReflowEngine() {
        this(new XmlDocParser());
    }

    public ReflowEngine(XmlDocParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * Reflows a block.
     *
     * @return the replacement for lines {@code startLine..endLine} joined with {@code \n}, or empty when the
     *         block has no markup or is already formatted
     */
    public Optional<String> reflow(CommentBlock block, ReflowConfig config) {
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(config, "config");

        List<XmlNode> nodes = parser.parse(block);
        if (nodes.stream().noneMatch(node -> node instanceof XmlNode.Element)) {
            return Optional.empty();
        }

        String prefix = block.blockComment()
                ? block.indentation() + CONTINUATION
                : block.indentation() + block.style().lineMarker() + " ";
        LineEmitter emitter = new LineEmitter(prefix, config);
        emitter.emitNodes(nodes, true);

        List<String> output = new ArrayList<>();
        if (block.blockComment()) {
            output.add(block.indentation() + block.style().blockOpen());
            output.addAll(emitter.lines());
            output.add(block.indentation() + " " + block.style().blockClose());
        } else {
            output.addAll(emitter.lines());
        }

        if (sameIgnoringTrailingWhitespace(output, block.rawLines())) {
            return Optional.empty();
        }
        LOGGER.debug("Reflowed comment block at lines {}-{} into {} lines",
                block.startLine() + 1, block.endLine() + 1, output.size());
        return Optional.of(String.join("\n", output));
    }

    private static boolean sameIgnoringTrailingWhitespace(List<String> formatted, List<String> original) {
        if (formatted.size() != original.size()) {
            return false;
        }
        for (int i = 0; i < formatted.size(); i++) {
            if (!formatted.get(i).stripTrailing().equals(original.get(i).stripTrailing())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Splits inline content into unbreakable tokens. Whitespace separates tokens except inside inline elements,
     * whose serialization stays glued to any adjacent non-space text.
     */
    static List<String> tokenize(List<XmlNode> nodes) {
        StringBuilder text = new StringBuilder();
        BitSet atomic = new BitSet();
        for (XmlNode node : nodes) {
            if (node instanceof XmlNode.Text literal) {
                text.append(literal.content());
            } else if (node instanceof XmlNode.Element element) {
                int start = text.length();
                text.append(serializeInline(element));
                atomic.set(start, text.length());
            } else {
                text.append(' ');
            }
        }

        List<String> tokens = new ArrayList<>();
        int tokenStart = -1;
        for (int i = 0; i < text.length(); i++) {
            boolean separator = !atomic.get(i) && Character.isWhitespace(text.charAt(i));
            if (separator && tokenStart >= 0) {
                tokens.add(text.substring(tokenStart, i));
                tokenStart = -1;
            } else if (!separator && tokenStart < 0) {
                tokenStart = i;
            }
        }
        if (tokenStart >= 0) {
            tokens.add(text.substring(tokenStart));
        }
        return tokens;
    }

    static String serializeInline(XmlNode.Element element) {
        if (element.selfClosing()) {
            return element.openTag();
        }
        StringBuilder builder = new StringBuilder(element.openTag());
        for (XmlNode child : element.children()) {
            if (child instanceof XmlNode.Text literal) {
                builder.append(literal.content().replaceAll("\\s+", " "));
            } else if (child instanceof XmlNode.Element nested) {
                builder.append(serializeInline(nested));
            } else {
                builder.append(' ');
            }
        }
        return builder.append(element.closeTag()).toString();
    }

    /**
     * Accumulates output lines for one reflow call.
     */
    private static final class LineEmitter {

        private final String prefix;
        private final String blankLine;
        private final ReflowConfig config;
        private final List<String> lines = new ArrayList<>();

        LineEmitter(String prefix, ReflowConfig config) {
            this.prefix = prefix;
            this.blankLine = prefix.stripTrailing();
            this.config = config;
        }

        List<String> lines() {
            return lines;
        }

        void emitNodes(List<XmlNode> nodes, boolean topLevel) {
            List<XmlNode> paragraph = new ArrayList<>();
            boolean hasContent = false;
            boolean pendingBlank = false;
            for (int i = 0; i < nodes.size(); i++) {
                XmlNode node = nodes.get(i);
                if (node instanceof XmlNode.BlankLine) {
                    if (config.preserveBlankLines()) {
                        if (emitParagraph(paragraph, pendingBlank)) {
                            pendingBlank = false;
                            hasContent = true;
                        }
                        pendingBlank = hasContent;
                    } else {
                        paragraph.add(new XmlNode.Text(" "));
                    }
                } else if (node instanceof XmlNode.Element element
                        && (!element.inline() || (topLevel && standsAlone(nodes, i)))) {
                    if (emitParagraph(paragraph, pendingBlank)) {
                        pendingBlank = false;
                    }
                    if (pendingBlank) {
                        lines.add(blankLine);
                        pendingBlank = false;
                    }
                    emitElement(element);
                    hasContent = true;
                } else {
                    paragraph.add(node);
                }
            }
            emitParagraph(paragraph, pendingBlank);
        }

        /**
         * Wraps and clears the pending paragraph; returns whether anything was written.
         */
        private boolean emitParagraph(List<XmlNode> paragraph, boolean blankBefore) {
            List<String> tokens = tokenize(paragraph);
            paragraph.clear();
            if (tokens.isEmpty()) {
                return false;
            }
            if (blankBefore) {
                lines.add(blankLine);
            }
            wrap(tokens);
            return true;
        }

        private void emitElement(XmlNode.Element element) {
            if (element.selfClosing()) {
                lines.add(prefix + element.openTag());
                return;
            }
            if (element.inline()) {
                lines.add(prefix + serializeInline(element));
                return;
            }
            if (element.isVerbatim()) {
                emitVerbatim(element);
                return;
            }
            if (config.useCompactStyle() && !element.hasBlockChildren()
                    && !(config.preserveBlankLines() && hasInnerBlankLine(element.children()))) {
                String single = element.openTag() + String.join(" ", tokenize(element.children())) + element.closeTag();
                if (prefix.length() + single.length() <= config.maxLineLength()) {
                    lines.add(prefix + single);
                    return;
                }
            }
            lines.add(prefix + element.openTag());
            emitNodes(element.children(), false);
            lines.add(prefix + element.closeTag());
        }

        private void emitVerbatim(XmlNode.Element element) {
            StringBuilder content = new StringBuilder();
            for (XmlNode child : element.children()) {
                if (child instanceof XmlNode.Text literal) {
                    content.append(literal.content());
                } else if (child instanceof XmlNode.Element nested) {
                    content.append(serializeInline(nested));
                } else {
                    content.append('\n');
                }
            }
            List<String> codeLines = new ArrayList<>(List.of(content.toString().split("\n", -1)));
            if (!codeLines.isEmpty() && codeLines.get(0).isBlank()) {
                codeLines.remove(0);
            }
            if (!codeLines.isEmpty() && codeLines.get(codeLines.size() - 1).isBlank()) {
                codeLines.remove(codeLines.size() - 1);
            }

            lines.add(prefix + element.openTag());
            for (String codeLine : codeLines) {
                lines.add(codeLine.isBlank() ? blankLine : prefix + codeLine.stripTrailing());
            }
            lines.add(prefix + element.closeTag());
        }

        private void wrap(List<String> tokens) {
            StringBuilder current = new StringBuilder(prefix);
            boolean empty = true;
            for (String token : tokens) {
                if (empty) {
                    current.append(token);
                    empty = false;
                } else if (current.length() + 1 + token.length() <= config.maxLineLength()) {
                    current.append(' ').append(token);
                } else {
                    lines.add(current.toString());
                    current = new StringBuilder(prefix).append(token);
                }
            }
            if (!empty) {
                lines.add(current.toString());
            }
        }

        /**
         * Whether a blank line separates two pieces of content; leading and trailing blank lines are dropped anyway.
         */
        private static boolean hasInnerBlankLine(List<XmlNode> children) {
            boolean seenContent = false;
            boolean blankAfterContent = false;
            for (XmlNode child : children) {
                if (child instanceof XmlNode.BlankLine) {
                    blankAfterContent = seenContent;
                } else if (!(child instanceof XmlNode.Text text) || !text.isBlank()) {
                    if (blankAfterContent) {
                        return true;
                    }
                    seenContent = true;
                }
            }
            return false;
        }

        /**
         * Whether a top-level inline element occupies its source line without other text.
         */
        private static boolean standsAlone(List<XmlNode> nodes, int index) {
            return (index == 0 || endsLine(nodes.get(index - 1)))
                    && (index == nodes.size() - 1 || startsLine(nodes.get(index + 1)));
        }

        private static boolean endsLine(XmlNode previous) {
            if (previous instanceof XmlNode.Text text) {
                String stripped = text.content().replaceAll("[ \\t]+$", "");
                return stripped.isEmpty() || stripped.endsWith("\n");
            }
            return !(previous instanceof XmlNode.Element element) || !element.inline();
        }

        private static boolean startsLine(XmlNode next) {
            if (next instanceof XmlNode.Text text) {
                String stripped = text.content().replaceAll("^[ \\t]+", "");
                return stripped.isEmpty() || stripped.startsWith("\n");
            }
            return !(next instanceof XmlNode.Element element) || !element.inline();
        }
    }
}
