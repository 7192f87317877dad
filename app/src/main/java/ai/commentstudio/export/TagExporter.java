package ai.commentstudio.export;

import ai.commentstudio.logging.SimpleJsonLayout;
import ai.commentstudio.tag.TagMatch;
import ai.commentstudio.tag.TagOccurrence;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Renders tag occurrences as TSV, CSV, a Markdown table or JSON.
 */
public class TagExporter {

    static final List<String> HEADERS = List.of("Type", "Message", "File", "Path", "Line", "Owner", "Issue", "Due", "Anchor ID");

    private static final String NEWLINE = "\n";

    public String export(List<TagOccurrence> occurrences, ExportFormat format) {
        Objects.requireNonNull(format, "format");
        List<TagOccurrence> items = occurrences == null ? List.of() : occurrences;
        return switch (format) {
            case TSV -> delimited(items, "\t", value -> value.replace('\t', ' ').replace('\n', ' '));
            case CSV -> delimited(items, ",", TagExporter::escapeCsv);
            case MARKDOWN -> markdown(items);
            case JSON -> json(items);
        };
    }

    private String delimited(List<TagOccurrence> items, String separator, UnaryOperator<String> escape) {
        StringBuilder builder = new StringBuilder();
        builder.append(String.join(separator, HEADERS)).append(NEWLINE);
        for (TagOccurrence item : items) {
            builder.append(row(item).stream().map(escape).collect(Collectors.joining(separator))).append(NEWLINE);
        }
        return builder.toString();
    }

    private String markdown(List<TagOccurrence> items) {
        StringBuilder builder = new StringBuilder();
        builder.append("# Code Anchors").append(NEWLINE).append(NEWLINE);
        builder.append("| ").append(String.join(" | ", HEADERS)).append(" |").append(NEWLINE);
        builder.append('|').append(HEADERS.stream().map(header -> "------").collect(Collectors.joining("|")))
                .append('|').append(NEWLINE);
        for (TagOccurrence item : items) {
            builder.append("| ")
                    .append(row(item).stream().map(TagExporter::escapeMarkdown).collect(Collectors.joining(" | ")))
                    .append(" |").append(NEWLINE);
        }
        builder.append(NEWLINE);
        builder.append('*').append(items.size()).append(items.size() == 1 ? " anchor" : " anchors").append('*')
                .append(NEWLINE);
        return builder.toString();
    }

    private String json(List<TagOccurrence> items) {
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < items.size(); i++) {
            TagOccurrence item = items.get(i);
            TagMatch match = item.match();
            builder.append(i == 0 ? NEWLINE : "," + NEWLINE).append("  {");
            builder.append("\"type\":").append(quote(match.tagName()));
            builder.append(",\"message\":").append(quote(match.message()));
            builder.append(",\"file\":").append(quote(item.fileName()));
            builder.append(",\"path\":").append(quote(item.filePath()));
            builder.append(",\"line\":").append(item.lineNumber());
            builder.append(",\"owner\":").append(quote(match.owner().orElse(null)));
            builder.append(",\"issue\":").append(match.issue().map(String::valueOf).orElse("null"));
            builder.append(",\"due\":").append(quote(match.dueDate().map(Object::toString).orElse(null)));
            builder.append(",\"anchorId\":").append(quote(match.anchorId().orElse(null)));
            builder.append('}');
        }
        if (!items.isEmpty()) {
            builder.append(NEWLINE);
        }
        return builder.append(']').append(NEWLINE).toString();
    }

    private static List<String> row(TagOccurrence item) {
        TagMatch match = item.match();
        return List.of(
                match.tagName(),
                match.message(),
                item.fileName(),
                item.filePath(),
                String.valueOf(item.lineNumber()),
                match.owner().orElse(""),
                match.issue().map(issue -> "#" + issue).orElse(""),
                match.dueDate().map(Object::toString).orElse(""),
                match.anchorId().orElse(""));
    }

    static String escapeCsv(String field) {
        if (field.contains(",") || field.contains("\"") || field.contains("\n") || field.contains("\r")) {
            return '"' + field.replace("\"", "\"\"") + '"';
        }
        return field;
    }

    static String escapeMarkdown(String value) {
        return value.replace("|", "\\|").replace("\r", "").replace("\n", " ");
    }

    static String quote(String value) {
        StringBuilder builder = new StringBuilder();
        SimpleJsonLayout.quote(builder, value);
        return builder.toString();
    }
}
