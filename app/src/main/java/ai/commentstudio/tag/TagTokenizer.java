package ai.commentstudio.tag;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds tag keywords such as {@code TODO(@owner, #123, 2026-02-01): message} in a single line.
 *
 * <p>A keyword counts only as the first word of comment content: after {@code //}, {@code /*}, {@code '},
 * {@code <!--} or a leading {@code *}. This keeps prose like "a straightforward bug fix" from matching. Text that
 * is not inside a comment may still start with a tag when it is followed by metadata or a colon.
 */
public class TagTokenizer {

    private static final DateTimeFormatter DUE_DATE = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern METADATA_SEPARATOR = Pattern.compile("[\\s,;]+");
    private static final Pattern OWNER = Pattern.compile("@\\S+");
    private static final Pattern ISSUE = Pattern.compile("#\\d+");

    public List<TagMatch> parse(String line, Collection<String> knownTags, Collection<String> customTags) {
        if (line == null || line.isEmpty()) {
            return List.of();
        }
        List<String> tags = TagKeywords.merge(knownTags, customTags);
        if (tags.isEmpty()) {
            return List.of();
        }

        List<TagMatch> matches = new ArrayList<>();
        int star = leadingStar(line);
        Optional<TagMatch> leading = star >= 0
                ? matchAt(line, skipWhitespace(line, star), tags, false)
                : matchAt(line, skipWhitespace(line, 0), tags, true);
        int index = 0;
        if (leading.isPresent()) {
            matches.add(leading.get());
            index = leading.get().spanEnd();
        }

        while (index < line.length()) {
            int contentStart = commentContentStart(line, index);
            if (contentStart < 0) {
                index++;
                continue;
            }
            Optional<TagMatch> match = matchAt(line, skipWhitespace(line, contentStart), tags, false);
            if (match.isPresent()) {
                matches.add(match.get());
                index = match.get().spanEnd();
            } else {
                index = contentStart;
            }
        }
        return List.copyOf(matches);
    }

    /**
     * Returns the position after the comment opener at {@code index}, or -1 when no opener starts there.
     */
    private static int commentContentStart(String line, int index) {
        if (line.startsWith("//", index)) {
            return skipAny(line, index + 2, "/!");
        }
        if (line.startsWith("/*", index)) {
            return skipAny(line, index + 2, "*!");
        }
        if (line.startsWith("<!--", index)) {
            return index + 4;
        }
        if (line.charAt(index) == '\'') {
            return skipAny(line, index + 1, "'");
        }
        return -1;
    }

    private static int leadingStar(String line) {
        int index = skipWhitespace(line, 0);
        if (index < line.length() && line.charAt(index) == '*' && !line.startsWith("*/", index)) {
            return skipAny(line, index, "*");
        }
        return -1;
    }

    /**
     * Matches a tag at {@code start}. Outside a comment ({@code delimited}) the tag must carry metadata or a colon.
     */
    private Optional<TagMatch> matchAt(String line, int start, List<String> tags, boolean delimited) {
        String tag = null;
        for (String candidate : tags) {
            int end = start + candidate.length();
            if (line.regionMatches(true, start, candidate, 0, candidate.length())
                    && (end == line.length() || !isWordChar(line.charAt(end)))
                    && (tag == null || candidate.length() > tag.length())) {
                tag = candidate;
            }
        }
        if (tag == null) {
            return Optional.empty();
        }

        int index = start + tag.length();
        Optional<String> metadata = Optional.empty();
        int afterSpace = skipWhitespace(line, index);
        if (afterSpace < line.length() && (line.charAt(afterSpace) == '(' || line.charAt(afterSpace) == '[')) {
            char close = line.charAt(afterSpace) == '(' ? ')' : ']';
            int closeIndex = line.indexOf(close, afterSpace + 1);
            if (closeIndex > 0) {
                String inner = line.substring(afterSpace + 1, closeIndex).strip();
                metadata = inner.isEmpty() ? Optional.empty() : Optional.of(inner);
                index = closeIndex + 1;
            }
        }
        afterSpace = skipWhitespace(line, index);
        boolean colon = afterSpace < line.length() && line.charAt(afterSpace) == ':';
        if (colon) {
            index = afterSpace + 1;
        }
        if (delimited && !colon && metadata.isEmpty()) {
            return Optional.empty();
        }

        Metadata parsed = parseMetadata(metadata.orElse(""));
        Optional<String> anchorId = Optional.empty();
        if (tag.equalsIgnoreCase(TagKeywords.ANCHOR) && metadata.isPresent()
                && parsed.owner().isEmpty() && parsed.issue().isEmpty() && parsed.dueDate().isEmpty()) {
            anchorId = metadata;
        }
        return Optional.of(new TagMatch(tag, start, index - start, parsed.owner(), parsed.issue(), parsed.dueDate(),
                anchorId, metadata, message(line, index)));
    }

    static Metadata parseMetadata(String raw) {
        Optional<String> owner = Optional.empty();
        Optional<Integer> issue = Optional.empty();
        Optional<LocalDate> dueDate = Optional.empty();
        for (String token : METADATA_SEPARATOR.split(raw.strip())) {
            if (token.isEmpty()) {
                continue;
            }
            if (owner.isEmpty() && OWNER.matcher(token).matches()) {
                owner = Optional.of(token.substring(1));
            } else if (issue.isEmpty() && ISSUE.matcher(token).matches()) {
                issue = parseIssue(token.substring(1));
            } else if (dueDate.isEmpty()) {
                dueDate = parseDate(token);
            }
        }
        return new Metadata(owner, issue, dueDate);
    }

    private static Optional<Integer> parseIssue(String digits) {
        try {
            return Optional.of(Integer.parseInt(digits));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static Optional<LocalDate> parseDate(String token) {
        try {
            return Optional.of(LocalDate.parse(token, DUE_DATE));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    private static String message(String line, int from) {
        String rest = line.substring(from);
        int end = rest.length();
        for (String closer : List.of("*/", "-->")) {
            int closerIndex = rest.indexOf(closer);
            if (closerIndex >= 0 && closerIndex < end) {
                end = closerIndex;
            }
        }
        return rest.substring(0, end).strip();
    }

    private static int skipAny(String line, int from, String characters) {
        int index = from;
        while (index < line.length() && characters.indexOf(line.charAt(index)) >= 0) {
            index++;
        }
        return index;
    }

    private static int skipWhitespace(String line, int from) {
        int index = from;
        while (index < line.length() && Character.isWhitespace(line.charAt(index))) {
            index++;
        }
        return index;
    }

    private static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    record Metadata(Optional<String> owner, Optional<Integer> issue, Optional<LocalDate> dueDate) {
    }
}
