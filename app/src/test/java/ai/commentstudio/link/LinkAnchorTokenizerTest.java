package ai.commentstudio.link;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LinkAnchorTokenizerTest {

    private final LinkAnchorTokenizer tokenizer = new LinkAnchorTokenizer();

    @Test
    void stopsPathAtFirstWordWithExtension() {
        List<LinkAnchorInfo> links = tokenizer.parse("// See LINK: Services/UserService.cs for implementation details.");

        assertThat(links).singleElement().satisfies(link -> {
            assertThat(link.filePath()).contains("Services/UserService.cs");
            assertThat(link.lineNumber()).isEmpty();
            assertThat(link.localAnchor()).isFalse();
            assertThat(link.spanStart()).isEqualTo(7);
            assertThat(link.targetStart()).isEqualTo(13);
            assertThat(link.targetLength()).isEqualTo("Services/UserService.cs".length());
        });
    }

    @Test
    void parsesLineRangeAndAnchor() {
        LinkAnchorInfo link = tokenizer.parse("// LINK: Database/Schema.sql:45-67#create-tables").get(0);

        assertThat(link.filePath()).contains("Database/Schema.sql");
        assertThat(link.lineNumber()).contains(45);
        assertThat(link.endLineNumber()).contains(67);
        assertThat(link.anchorName()).contains("create-tables");
        assertThat(link.hasLineRange()).isTrue();
    }

    @Test
    void parsesLocalAnchor() {
        LinkAnchorInfo link = tokenizer.parse("// LINK: #local-anchor").get(0);

        assertThat(link.localAnchor()).isTrue();
        assertThat(link.filePath()).isEmpty();
        assertThat(link.anchorName()).contains("local-anchor");
    }

    @Test
    void allowsSpacesInsidePaths() {
        assertThat(tokenizer.parse("// LINK: images/Add group calendar.png").get(0).filePath())
                .contains("images/Add group calendar.png");

        LinkAnchorInfo withLine = tokenizer.parse("// LINK: path/My File.cs:45").get(0);
        assertThat(withLine.filePath()).contains("path/My File.cs");
        assertThat(withLine.lineNumber()).contains(45);

        LinkAnchorInfo withAnchor = tokenizer.parse("// LINK: docs/User Guide.md#getting-started").get(0);
        assertThat(withAnchor.filePath()).contains("docs/User Guide.md");
        assertThat(withAnchor.anchorName()).contains("getting-started");
    }

    @Test
    void tokenizesSeveralLinksLeftToRight() {
        List<LinkAnchorInfo> links = tokenizer.parse("// LINK: a.cs LINK: b.cs:10");

        assertThat(links)
                .extracting(LinkAnchorInfo::filePath, LinkAnchorInfo::lineNumber, LinkAnchorInfo::spanStart)
                .containsExactly(
                        tuple(Optional.of("a.cs"), Optional.empty(), 3),
                        tuple(Optional.of("b.cs"), Optional.of(10), 14));
    }

    @Test
    void malformedSuffixesDegradeToPathText() {
        LinkAnchorInfo descending = tokenizer.parse("// LINK: file.cs:50-40").get(0);
        assertThat(descending.filePath()).contains("file.cs");
        assertThat(descending.lineNumber()).contains(50);
        assertThat(descending.endLineNumber()).isEmpty();
        assertThat(descending.targetLength()).isEqualTo("file.cs:50".length());
        assertThat(descending.describeTarget()).isEqualTo("file.cs:50");

        LinkAnchorInfo zero = tokenizer.parse("// LINK: file.cs:0").get(0);
        assertThat(zero.filePath()).contains("file.cs:0");
        assertThat(zero.lineNumber()).isEmpty();

        LinkAnchorInfo named = tokenizer.parse("// LINK: notes.md:intro").get(0);
        assertThat(named.filePath()).contains("notes.md:intro");
    }

    @Test
    void excludesCommentClosersAndTrailingPunctuation() {
        assertThat(tokenizer.parse("/* LINK: a.cs */").get(0).filePath()).contains("a.cs");
        assertThat(tokenizer.parse("<!-- LINK: docs/readme.md -->").get(0).filePath()).contains("docs/readme.md");
        assertThat(tokenizer.parse("// LINK: a.cs.").get(0).filePath()).contains("a.cs");
    }

    @Test
    void lineSuffixFollowedByPunctuationEndsTarget() {
        LinkAnchorInfo sentence = tokenizer.parse("// See LINK: Foo.cs:42. Then more text.").get(0);
        assertThat(sentence.filePath()).contains("Foo.cs");
        assertThat(sentence.lineNumber()).contains(42);
        assertThat(sentence.targetLength()).isEqualTo("Foo.cs:42".length());

        LinkAnchorInfo range = tokenizer.parse("// LINK: a.cs:10-20, see above").get(0);
        assertThat(range.filePath()).contains("a.cs");
        assertThat(range.lineNumber()).contains(10);
        assertThat(range.endLineNumber()).contains(20);
    }

    @Test
    void acceptsEveryPathPrefix() {
        List<String> lines = List.of(
                "// LINK: ../../a.cs",
                "// LINK: /abs/a.cs",
                "// LINK: ~/a.cs",
                "// LINK: @/p/a.cs",
                "// LINK: C:/Users/test/file.cs:12");

        assertThat(lines)
                .extracting(line -> tokenizer.parse(line).get(0))
                .extracting(LinkAnchorInfo::filePath, LinkAnchorInfo::lineNumber)
                .containsExactly(
                        tuple(Optional.of("../../a.cs"), Optional.empty()),
                        tuple(Optional.of("/abs/a.cs"), Optional.empty()),
                        tuple(Optional.of("~/a.cs"), Optional.empty()),
                        tuple(Optional.of("@/p/a.cs"), Optional.empty()),
                        tuple(Optional.of("C:/Users/test/file.cs"), Optional.of(12)));
    }

    @Test
    void keywordRules() {
        assertThat(tokenizer.parse("// link: a.cs")).hasSize(1);
        assertThat(tokenizer.parse("// LINK ./relative/file.cs")).hasSize(1);
        assertThat(tokenizer.parse("// follow the link text here")).isEmpty();
        assertThat(tokenizer.parse("// LINKED list")).isEmpty();
        assertThat(tokenizer.parse("// LINK:")).isEmpty();
    }

    @Test
    void linesWithoutKeywordTakeFastPath() {
        assertThat(tokenizer.containsLink("// nothing to see")).isFalse();
        assertThat(tokenizer.containsLink("// a Link here")).isTrue();
        assertThat(tokenizer.parse("// nothing to see")).isEmpty();
        assertThat(tokenizer.parse(null)).isEmpty();
    }

    @Test
    void findsLinkByOffsetWithinTarget() {
        String line = "// LINK: a.cs:10";

        assertThat(tokenizer.findAt(line, 9)).isPresent();
        assertThat(tokenizer.findAt(line, 16)).isPresent();
        assertThat(tokenizer.findAt(line, 3)).isEmpty();
    }
}
