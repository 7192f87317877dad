package ai.commentstudio.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.commentstudio.tag.TagMatch;
import ai.commentstudio.tag.TagOccurrence;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TagExporterTest {

    private final TagExporter exporter = new TagExporter();

    private final TagOccurrence todo = new TagOccurrence("src/Services/UserService.cs", 12,
            new TagMatch("TODO", 3, 31, Optional.of("mads"), Optional.of(1234), Optional.of(LocalDate.of(2026, 2, 1)),
                    Optional.empty(), Optional.of("@mads, #1234, 2026-02-01"), "Refactor this"));

    private final TagOccurrence note = new TagOccurrence("src/A.cs", 3,
            new TagMatch("NOTE", 3, 5, Optional.empty(), Optional.empty(), Optional.empty(),
                    Optional.empty(), Optional.empty(), "keep a, b | c \"quoted\""));

    @Test
    void writesTabSeparatedRows() {
        String tsv = exporter.export(List.of(todo), ExportFormat.TSV);

        assertThat(tsv.split("\n")).containsExactly(
                "Type\tMessage\tFile\tPath\tLine\tOwner\tIssue\tDue\tAnchor ID",
                "TODO\tRefactor this\tUserService.cs\tsrc/Services/UserService.cs\t12\tmads\t#1234\t2026-02-01\t");
    }

    @Test
    void quotesCsvFieldsWithSeparatorsOrQuotes() {
        String csv = exporter.export(List.of(note), ExportFormat.CSV);

        assertThat(csv).endsWith("NOTE,\"keep a, b | c \"\"quoted\"\"\",A.cs,src/A.cs,3,,,,\n");
    }

    @Test
    void rendersMarkdownTableWithSummary() {
        String markdown = exporter.export(List.of(note), ExportFormat.MARKDOWN);

        assertThat(markdown).startsWith("# Code Anchors\n\n| Type | Message |");
        assertThat(markdown).contains("|------|------|");
        assertThat(markdown).contains("| NOTE | keep a, b \\| c \"quoted\" | A.cs |");
        assertThat(markdown).endsWith("\n*1 anchor*\n");
        assertThat(exporter.export(List.of(todo, note), ExportFormat.MARKDOWN)).endsWith("*2 anchors*\n");
    }

    @Test
    void rendersJsonArray() {
        String json = exporter.export(List.of(todo, note), ExportFormat.JSON);

        assertThat(json).startsWith("[\n  {\"type\":\"TODO\",\"message\":\"Refactor this\",\"file\":\"UserService.cs\"");
        assertThat(json).contains("\"line\":12,\"owner\":\"mads\",\"issue\":1234,\"due\":\"2026-02-01\",\"anchorId\":null}");
        assertThat(json).contains("\"message\":\"keep a, b | c \\\"quoted\\\"\"");
        assertThat(json).contains("\"issue\":null");
        assertThat(json).endsWith("}\n]\n");
        assertThat(exporter.export(List.of(), ExportFormat.JSON)).isEqualTo("[]\n");
    }

    @Test
    void escapesControlCharactersInJson() {
        TagOccurrence multiline = new TagOccurrence("src/A.cs", 1,
                new TagMatch("BUG", 3, 4, Optional.empty(), Optional.empty(), Optional.empty(),
                        Optional.empty(), Optional.empty(), "tab\there\nnext \\ path"));

        String json = exporter.export(List.of(multiline), ExportFormat.JSON);

        assertThat(json).contains("\"message\":\"tab\\there\\nnext \\\\ path\"");
        assertThat(TagExporter.quote(null)).isEqualTo("null");
    }

    @Test
    void parsesFormatNamesAndExtensions() {
        assertThat(ExportFormat.from("markdown")).isEqualTo(ExportFormat.MARKDOWN);
        assertThat(ExportFormat.from("MD")).isEqualTo(ExportFormat.MARKDOWN);
        assertThat(ExportFormat.from(" json ")).isEqualTo(ExportFormat.JSON);
        assertThat(ExportFormat.from(null)).isEqualTo(ExportFormat.TSV);

        Throwable thrown = catchThrowable(() -> ExportFormat.from("xml"));
        assertThat(thrown).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("xml");
    }
}
