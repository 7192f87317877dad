package ai.commentstudio.xml;

import ai.commentstudio.scan.CommentBlock;
import ai.commentstudio.style.CommentStyle;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses the body of a documentation comment block into a tree of {@link XmlNode}s.
 * Markup that is malformed or never closed is kept as literal text; parsing never fails.
 */
public class XmlDocParser {

    private static final XmlNode.BlankLine BLANK_LINE = new XmlNode.BlankLine();

    public List<XmlNode> parse(CommentBlock block) {
        return parseBody(bodyLines(block));
    }

    /**
     * Returns the comment text of each line with markers, continuation stars and trailing whitespace removed.
     */
    public List<String> bodyLines(CommentBlock block) {
        Objects.requireNonNull(block, "block");
        return block.blockComment() ? blockCommentBody(block) : markerBody(block);
    }

    public List<XmlNode> parseBody(List<String> bodyLines) {
        if (bodyLines == null || bodyLines.isEmpty()) {
            return List.of();
        }
        BitSet blankLines = new BitSet(bodyLines.size());
        for (int i = 0; i < bodyLines.size(); i++) {
            if (bodyLines.get(i).isBlank()) {
                blankLines.set(i);
            }
        }
        return new Cursor(String.join("\n", bodyLines), blankLines).parseDocument();
    }

    private List<String> markerBody(CommentBlock block) {
        String marker = block.style().lineMarker();
        List<String> body = new ArrayList<>(block.rawLines().size());
        for (String raw : block.rawLines()) {
            String text = raw.stripLeading();
            if (text.startsWith(marker)) {
                text = text.substring(marker.length());
            }
            body.add(dropOneSpace(text).stripTrailing());
        }
        return body;
    }

    private List<String> blockCommentBody(CommentBlock block) {
        CommentStyle style = block.style();
        List<String> raw = block.rawLines();
        List<String> body = new ArrayList<>(raw.size());
        for (int i = 0; i < raw.size(); i++) {
            String text = raw.get(i).stripLeading();
            boolean delimiterLine = false;
            if (i == 0 && text.startsWith(style.blockOpen())) {
                text = text.substring(style.blockOpen().length());
                delimiterLine = true;
            } else if (text.startsWith("*") && !text.startsWith(style.blockClose())) {
                text = text.substring(1);
            }
            int close = text.indexOf(style.blockClose());
            if (close >= 0) {
                text = text.substring(0, close);
                delimiterLine = true;
            }
            text = dropOneSpace(text).stripTrailing();
            if (delimiterLine && text.isBlank()) {
                continue;
            }
            body.add(text);
        }
        return body;
    }

    private static String dropOneSpace(String text) {
        return !text.isEmpty() && text.charAt(0) == ' ' ? text.substring(1) : text;
    }

    /**
     * Recursive-descent state for a single parse.
     */
    private static final class Cursor {

        private final String source;
        private final BitSet blankLines;
        private final Deque<String> openTags = new ArrayDeque<>();
        private int position;
        private int line;

        Cursor(String source, BitSet blankLines) {
            this.source = source;
            this.blankLines = blankLines;
        }

        List<XmlNode> parseDocument() {
            List<XmlNode> nodes = new ArrayList<>();
            if (blankLines.get(0)) {
                nodes.add(BLANK_LINE);
                skipLineWhitespace();
            }
            nodes.addAll(parseNodes(null).nodes());
            return mergeText(nodes);
        }

        private Sequence parseNodes(String closingTag) {
            List<XmlNode> nodes = new ArrayList<>();
            StringBuilder text = new StringBuilder();
            while (position < source.length()) {
                char ch = source.charAt(position);
                if (ch == '\n') {
                    text.append(ch);
                    position++;
                    line++;
                    if (blankLines.get(line)) {
                        flush(text, nodes);
                        nodes.add(BLANK_LINE);
                        skipLineWhitespace();
                    }
                    continue;
                }
                if (ch != '<') {
                    text.append(ch);
                    position++;
                    continue;
                }
                if (source.startsWith("</", position)) {
                    EndTag end = readEndTag();
                    if (end == null) {
                        text.append(ch);
                        position++;
                    } else if (end.name().equals(closingTag)) {
                        flush(text, nodes);
                        position = end.endPosition();
                        return new Sequence(mergeText(nodes), true);
                    } else if (openTags.contains(end.name())) {
                        // an ancestor closes first; leave its end tag for the ancestor
                        flush(text, nodes);
                        return new Sequence(mergeText(nodes), false);
                    } else {
                        text.append(source, position, end.endPosition());
                        position = end.endPosition();
                    }
                    continue;
                }
                StartTag start = readStartTag();
                if (start == null) {
                    text.append(ch);
                    position++;
                    continue;
                }
                flush(text, nodes);
                advanceTo(start.endPosition());
                if (start.selfClosing()) {
                    nodes.add(element(start, List.of()));
                } else if (ElementKind.fromTagName(start.name()) == ElementKind.CODE) {
                    readVerbatim(start, nodes, text);
                } else {
                    openTags.push(start.name());
                    Sequence inner = parseNodes(start.name());
                    openTags.pop();
                    if (inner.closed()) {
                        nodes.add(element(start, inner.nodes()));
                    } else {
                        nodes.add(new XmlNode.Text(start.raw()));
                        nodes.addAll(inner.nodes());
                    }
                }
            }
            flush(text, nodes);
            return new Sequence(mergeText(nodes), false);
        }

        private void readVerbatim(StartTag start, List<XmlNode> nodes, StringBuilder text) {
            String closeTag = "</" + start.name() + ">";
            int close = source.indexOf(closeTag, position);
            if (close < 0) {
                text.append(start.raw());
                return;
            }
            String content = source.substring(position, close);
            advanceTo(close + closeTag.length());
            nodes.add(element(start, List.of(new XmlNode.Text(content))));
        }

        private XmlNode.Element element(StartTag start, List<XmlNode> children) {
            ElementKind kind = ElementKind.fromTagName(start.name());
            boolean inline = kind.layout() == ElementKind.Layout.INLINE;
            if (kind == ElementKind.GENERIC) {
                inline = children.stream().noneMatch(child -> child instanceof XmlNode.Element nested && !nested.inline());
            }
            return new XmlNode.Element(start.name(), kind, start.attributes(), children, inline,
                    start.selfClosing(), start.raw());
        }

        private StartTag readStartTag() {
            int index = position + 1;
            int nameEnd = scanName(index);
            if (nameEnd == index) {
                return null;
            }
            String name = source.substring(index, nameEnd);
            index = nameEnd;
            Map<String, String> attributes = new LinkedHashMap<>();
            while (index < source.length()) {
                int afterSpace = skipWhitespace(index);
                if (afterSpace >= source.length()) {
                    return null;
                }
                if (source.startsWith("/>", afterSpace)) {
                    return new StartTag(name, attributes, true, afterSpace + 2, collapse(source.substring(position, afterSpace + 2)));
                }
                if (source.charAt(afterSpace) == '>') {
                    return new StartTag(name, attributes, false, afterSpace + 1, collapse(source.substring(position, afterSpace + 1)));
                }
                if (afterSpace == index) {
                    return null;
                }
                int attributeEnd = scanName(afterSpace);
                if (attributeEnd == afterSpace) {
                    return null;
                }
                String attributeName = source.substring(afterSpace, attributeEnd);
                int equals = skipWhitespace(attributeEnd);
                if (equals >= source.length() || source.charAt(equals) != '=') {
                    return null;
                }
                int quote = skipWhitespace(equals + 1);
                if (quote >= source.length() || (source.charAt(quote) != '"' && source.charAt(quote) != '\'')) {
                    return null;
                }
                int valueEnd = source.indexOf(source.charAt(quote), quote + 1);
                if (valueEnd < 0) {
                    return null;
                }
                attributes.putIfAbsent(attributeName, source.substring(quote + 1, valueEnd));
                index = valueEnd + 1;
            }
            return null;
        }

        private EndTag readEndTag() {
            int index = position + 2;
            int nameEnd = scanName(index);
            if (nameEnd == index) {
                return null;
            }
            int close = skipWhitespace(nameEnd);
            if (close >= source.length() || source.charAt(close) != '>') {
                return null;
            }
            return new EndTag(source.substring(index, nameEnd), close + 1);
        }

        private int scanName(int from) {
            if (from >= source.length()) {
                return from;
            }
            char first = source.charAt(from);
            if (!Character.isLetter(first) && first != '_') {
                return from;
            }
            int index = from + 1;
            while (index < source.length()) {
                char ch = source.charAt(index);
                if (!Character.isLetterOrDigit(ch) && ch != '_' && ch != ':' && ch != '.' && ch != '-') {
                    break;
                }
                index++;
            }
            return index;
        }

        private int skipWhitespace(int from) {
            int index = from;
            while (index < source.length() && Character.isWhitespace(source.charAt(index))) {
                index++;
            }
            return index;
        }

        private void skipLineWhitespace() {
            while (position < source.length() && source.charAt(position) != '\n'
                    && Character.isWhitespace(source.charAt(position))) {
                position++;
            }
        }

        private void advanceTo(int target) {
            for (int i = position; i < target; i++) {
                if (source.charAt(i) == '\n') {
                    line++;
                }
            }
            position = target;
        }

        private static void flush(StringBuilder text, List<XmlNode> nodes) {
            if (text.length() > 0) {
                nodes.add(new XmlNode.Text(text.toString()));
                text.setLength(0);
            }
        }

        private static String collapse(String raw) {
            return raw.replaceAll("\\s+", " ");
        }

        private static List<XmlNode> mergeText(List<XmlNode> nodes) {
            List<XmlNode> merged = new ArrayList<>(nodes.size());
            for (XmlNode node : nodes) {
                int last = merged.size() - 1;
                if (node instanceof XmlNode.Text text && last >= 0 && merged.get(last) instanceof XmlNode.Text previous) {
                    merged.set(last, new XmlNode.Text(previous.content() + text.content()));
                } else {
                    merged.add(node);
                }
            }
            return merged;
        }
    }

    private record Sequence(List<XmlNode> nodes, boolean closed) {
    }

    private record StartTag(String name, Map<String, String> attributes, boolean selfClosing, int endPosition, String raw) {
    }

    private record EndTag(String name, int endPosition) {
    }
}
