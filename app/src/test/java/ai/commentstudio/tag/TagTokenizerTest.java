package ai.commentstudio.tag;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class TagTokenizerTest {

    private final TagTokenizer tokenizer = new TagTokenizer();

    @Test
    void extractsOwnerIssueAndDueDate() {
        TagMatch match = parse("// TODO(@mads, #1234, 2026-02-01): Refactor this").get(0);

        assertThat(match.tagName()).isEqualTo("TODO");
        assertThat(match.spanStart()).isEqualTo(3);
        assertThat(match.owner()).contains("mads");
        assertThat(match.issue()).contains(1234);
        assertThat(match.dueDate()).contains(LocalDate.of(2026, 2, 1));
        assertThat(match.metadata()).contains("@mads, #1234, 2026-02-01");
        assertThat(match.message()).isEqualTo("Refactor this");
    }

    @Test
    void acceptsTagWithMetadataOutsideComment() {
        TagMatch match = parse("TODO(@mads, #1234, 2026-02-01): Refactor this").get(0);

        assertThat(match.tagName()).isEqualTo("TODO");
        assertThat(match.spanStart()).isZero();
        assertThat(match.issue()).contains(1234);
    }

    @Test
    void ignoresInvalidDates() {
        TagMatch match = parse("// TODO(2026-02-32): bad date").get(0);

        assertThat(match.dueDate()).isEmpty();
        assertThat(match.message()).isEqualTo("bad date");
    }

    @Test
    void keepsFirstMetadataTokenOfEachKind() {
        TagMatch match = parse("// TODO(@a @b #1 #2 2026-01-01 2026-01-02 junk)").get(0);

        assertThat(match.owner()).contains("a");
        assertThat(match.issue()).contains(1);
        assertThat(match.dueDate()).contains(LocalDate.of(2026, 1, 1));
        assertThat(match.anchorId()).isEmpty();
        assertThat(match.message()).isEmpty();
    }

    @Test
    void requiresZeroPaddedDueDate() {
        TagMatch match = parse("// TODO(@ann, 2026-2-1): unpadded").get(0);

        assertThat(match.owner()).contains("ann");
        assertThat(match.dueDate()).isEmpty();
    }

    @Test
    void recognizesEveryCommentPrefix() {
        assertThat(parse("// HACK: workaround")).extracting(TagMatch::tagName).containsExactly("HACK");
        assertThat(parse("' NOTE: vb comment")).extracting(TagMatch::tagName).containsExactly("NOTE");
        assertThat(parse("<!-- REVIEW: check -->")).extracting(TagMatch::message).containsExactly("check");
        assertThat(parse(" * BUG: broken")).extracting(TagMatch::tagName).containsExactly("BUG");
        assertThat(parse("int x = 1; // FIXME: overflow")).extracting(TagMatch::spanStart).containsExactly(14);
    }

    @Test
    void readsBracketMetadataInsideBlockComment() {
        TagMatch match = parse("/* FIXME[#42] leak */").get(0);

        assertThat(match.issue()).contains(42);
        assertThat(match.message()).isEqualTo("leak");
        assertThat(match.spanLength()).isEqualTo("FIXME[#42]".length());
    }

    @Test
    void tagMustBeFirstWordOfComment() {
        assertThat(parse("// this is a straightforward bug fix")).isEmpty();
        assertThat(parse("// TODOS are fine")).isEmpty();
        assertThat(parse("Note that plain text is ignored")).isEmpty();
    }

    @Test
    void matchesCaseInsensitivelyAndReportsConfiguredSpelling() {
        assertThat(parse("// todo: lower case")).extracting(TagMatch::tagName).containsExactly("TODO");
    }

    @Test
    void supportsCustomTags() {
        assertThat(tokenizer.parse("// PERF: slow path", TagKeywords.BUILT_IN, List.of("PERF")))
                .extracting(TagMatch::tagName).containsExactly("PERF");
        assertThat(parse("// PERF: slow path")).isEmpty();
    }

    @Test
    void anchorMetadataBecomesAnchorId() {
        TagMatch anchor = parse("// ANCHOR(install-steps): Installation").get(0);
        assertThat(anchor.anchorId()).contains("install-steps");
        assertThat(anchor.message()).isEqualTo("Installation");

        TagMatch owned = parse("// ANCHOR(@mads)").get(0);
        assertThat(owned.anchorId()).isEmpty();
        assertThat(owned.owner()).contains("mads");
    }

    private List<TagMatch> parse(String line) {
        return tokenizer.parse(line, TagKeywords.BUILT_IN, List.of());
    }
}
