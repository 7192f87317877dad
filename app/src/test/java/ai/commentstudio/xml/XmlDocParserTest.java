package ai.commentstudio.xml;

import static org.assertj.core.api.Assertions.assertThat;

import ai.commentstudio.scan.CommentBlock;
import ai.commentstudio.style.CommentStyleCatalog;
import java.util.List;
import org.junit.jupiter.api.Test;

class XmlDocParserTest {

    private final XmlDocParser parser = new XmlDocParser();

    @Test
    void buildsElementTreeWithInlineChildren() {
        List<XmlNode> nodes = parser.parseBody(List.of("<summary>", "Hello <c>x</c> world.", "</summary>"));

        assertThat(nodes).hasSize(1);
        XmlNode.Element summary = (XmlNode.Element) nodes.get(0);
        assertThat(summary.kind()).isEqualTo(ElementKind.SUMMARY);
        assertThat(summary.inline()).isFalse();
        assertThat(summary.children()).containsExactly(
                new XmlNode.Text("\nHello "),
                new XmlNode.Element("c", ElementKind.C, null, List.of(new XmlNode.Text("x")), true, false, "<c>"),
                new XmlNode.Text(" world.\n"));
    }

    @Test
    void recordsBlankLinesInsideElements() {
        List<XmlNode> nodes = parser.parseBody(List.of("<remarks>", "First.", "", "Second.", "</remarks>"));

        XmlNode.Element remarks = (XmlNode.Element) nodes.get(0);
        assertThat(remarks.children()).containsExactly(
                new XmlNode.Text("\nFirst.\n"),
                new XmlNode.BlankLine(),
                new XmlNode.Text("\nSecond.\n"));
    }

    @Test
    void parsesAttributesAndSelfClosingTags() {
        List<XmlNode> nodes = parser.parseBody(List.of("<see cref=\"Foo\"/> and <param name='value'>v</param>"));

        XmlNode.Element see = (XmlNode.Element) nodes.get(0);
        assertThat(see.selfClosing()).isTrue();
        assertThat(see.attribute("cref")).isEqualTo("Foo");
        assertThat(see.openTag()).isEqualTo("<see cref=\"Foo\"/>");
        assertThat(see.closeTag()).isEmpty();
        XmlNode.Element param = (XmlNode.Element) nodes.get(2);
        assertThat(param.kind()).isEqualTo(ElementKind.PARAM);
        assertThat(param.attribute("name")).isEqualTo("value");
    }

    @Test
    void unclosedElementDegradesToText() {
        List<XmlNode> nodes = parser.parseBody(List.of("<summary>Text <b>bold"));

        assertThat(nodes).containsExactly(new XmlNode.Text("<summary>Text <b>bold"));
    }

    @Test
    void elementClosedByAncestorDegradesToText() {
        List<XmlNode> nodes = parser.parseBody(List.of("<summary>a <c>b</summary>"));

        XmlNode.Element summary = (XmlNode.Element) nodes.get(0);
        assertThat(summary.tagName()).isEqualTo("summary");
        assertThat(summary.children()).containsExactly(new XmlNode.Text("a <c>b"));
    }

    @Test
    void strayEndTagsAndLooseAngleBracketsStayLiteral() {
        assertThat(parser.parseBody(List.of("text </para> more"))).containsExactly(new XmlNode.Text("text </para> more"));
        assertThat(parser.parseBody(List.of("a < b and x<3"))).containsExactly(new XmlNode.Text("a < b and x<3"));
    }

    @Test
    void codeContentIsCapturedVerbatim() {
        List<XmlNode> nodes = parser.parseBody(List.of("<code>", "  var x = 1;", "", "  Run(x);", "</code>"));

        XmlNode.Element code = (XmlNode.Element) nodes.get(0);
        assertThat(code.isVerbatim()).isTrue();
        assertThat(code.children()).containsExactly(new XmlNode.Text("\n  var x = 1;\n\n  Run(x);\n"));
    }

    @Test
    void genericElementWithBlockChildIsBlockLevel() {
        List<XmlNode> nodes = parser.parseBody(List.of("<custom><para>p</para></custom> <custom>i</custom>"));

        assertThat(((XmlNode.Element) nodes.get(0)).inline()).isFalse();
        assertThat(((XmlNode.Element) nodes.get(2)).inline()).isTrue();
    }

    @Test
    void extractsBodyFromMarkerLines() {
        CommentBlock block = new CommentBlock(0, 1, List.of("    /// <summary>", "    ///   indented  "),
                CommentStyleCatalog.CSHARP, "    ", false);

        assertThat(parser.bodyLines(block)).containsExactly("<summary>", "  indented");
    }

    @Test
    void extractsBodyFromBlockComments() {
        CommentBlock block = new CommentBlock(0, 2, List.of("/**", " * <summary>Hi</summary>", " */"),
                CommentStyleCatalog.CSHARP, "", true);

        assertThat(parser.bodyLines(block)).containsExactly("<summary>Hi</summary>");
    }
}
