package ai.commentstudio.xml;

import java.util.Locale;

/**
 * Closed set of documentation tags with known layout, plus {@link #GENERIC} for everything else.
 */
public enum ElementKind {
    SUMMARY("summary", Layout.BLOCK),
    REMARKS("remarks", Layout.BLOCK),
    RETURNS("returns", Layout.BLOCK),
    VALUE("value", Layout.BLOCK),
    PARAM("param", Layout.BLOCK),
    TYPEPARAM("typeparam", Layout.BLOCK),
    EXCEPTION("exception", Layout.BLOCK),
    EXAMPLE("example", Layout.BLOCK),
    PERMISSION("permission", Layout.BLOCK),
    PARA("para", Layout.BLOCK),
    LIST("list", Layout.BLOCK),
    LISTHEADER("listheader", Layout.BLOCK),
    ITEM("item", Layout.BLOCK),
    TERM("term", Layout.BLOCK),
    DESCRIPTION("description", Layout.BLOCK),
    INHERITDOC("inheritdoc", Layout.BLOCK),
    INCLUDE("include", Layout.BLOCK),
    CODE("code", Layout.VERBATIM),
    C("c", Layout.INLINE),
    SEE("see", Layout.INLINE),
    SEEALSO("seealso", Layout.INLINE),
    PARAMREF("paramref", Layout.INLINE),
    TYPEPARAMREF("typeparamref", Layout.INLINE),
    GENERIC("", Layout.INLINE);

    /**
     * How an element is laid out when a comment is reflowed.
     */
    public enum Layout {
        /** Always starts on its own line; content is wrapped. */
        BLOCK,
        /** Shares lines with surrounding text and is never broken across lines. */
        INLINE,
        /** Starts on its own line; content is copied verbatim. */
        VERBATIM
    }

    private final String tagName;
    private final Layout layout;

    ElementKind(String tagName, Layout layout) {
        this.tagName = tagName;
        this.layout = layout;
    }

    public String tagName() {
        return tagName;
    }

    public Layout layout() {
        return layout;
    }

    public static ElementKind fromTagName(String name) {
        if (name == null || name.isEmpty()) {
            return GENERIC;
        }
        String normalized = name.toLowerCase(Locale.ROOT);
        for (ElementKind kind : values()) {
            if (kind != GENERIC && kind.tagName.equals(normalized)) {
                return kind;
            }
        }
        return GENERIC;
    }
}
