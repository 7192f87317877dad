package ai.commentstudio.xml;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Node of a parsed documentation comment body.
 */
public sealed interface XmlNode {

    /**
     * Literal text, including markup that could not be parsed as a tag.
     */
    record Text(String content) implements XmlNode {

        public Text {
            Objects.requireNonNull(content, "content");
        }

        public boolean isBlank() {
            return content.isBlank();
        }
    }

    /**
     * A tag with its children.
     *
     * @param openTag the opening tag as written, with runs of whitespace collapsed to one space
     */
    record Element(String tagName,
                   ElementKind kind,
                   Map<String, String> attributes,
                   List<XmlNode> children,
                   boolean inline,
                   boolean selfClosing,
                   String openTag) implements XmlNode {

        public Element {
            Objects.requireNonNull(tagName, "tagName");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(openTag, "openTag");
            attributes = attributes == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
            children = children == null ? List.of() : List.copyOf(children);
        }

        public String closeTag() {
            return selfClosing ? "" : "</" + tagName + ">";
        }

        public String attribute(String name) {
            return attributes.get(name);
        }

        public boolean isVerbatim() {
            return kind.layout() == ElementKind.Layout.VERBATIM;
        }

        public boolean hasBlockChildren() {
            return children.stream().anyMatch(child -> child instanceof Element element && !element.inline());
        }
    }

    /**
     * A line of the original comment that held no content.
     */
    record BlankLine() implements XmlNode {
    }
}
