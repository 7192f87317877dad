package ai.commentstudio.link;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates {@code LINK:} references in a single line.
 *
 * <p>Accepted forms: {@code LINK: path/to/file.cs}, {@code LINK ./file.cs:45}, {@code LINK: ../Schema.sql:100-150},
 * {@code LINK: Services/UserService.cs#validate-input}, {@code link: #local-anchor}. Paths may contain spaces.
 */
public class LinkAnchorTokenizer {

    private static final String KEYWORD = "LINK";
    private static final Pattern LINE_SUFFIX = Pattern.compile("^(.*?):(\\d+)(?:-(\\d+))?$", Pattern.DOTALL);
    private static final String TRAILING_PUNCTUATION = ".,;)";

    public List<LinkAnchorInfo> parse(String line) {
        if (!containsLink(line)) {
            return List.of();
        }
        List<Keyword> keywords = findKeywords(line);
        List<LinkAnchorInfo> links = new ArrayList<>(keywords.size());
        for (int i = 0; i < keywords.size(); i++) {
            Keyword keyword = keywords.get(i);
            int bodyEnd = i + 1 < keywords.size() ? keywords.get(i + 1).start() : line.length();
            parseBody(line, keyword, bodyEnd).ifPresent(links::add);
        }
        return List.copyOf(links);
    }

    /**
     * Returns the reference whose target covers {@code offset}; the position just past the target still matches.
     */
    public Optional<LinkAnchorInfo> findAt(String line, int offset) {
        return parse(line).stream()
                .filter(link -> offset >= link.targetStart() && offset <= link.targetEnd())
                .findFirst();
    }

    /**
     * Case-insensitive substring check used to skip lines without any reference.
     */
    public boolean containsLink(String line) {
        if (line == null || line.length() < KEYWORD.length()) {
            return false;
        }
        for (int i = 0; i <= line.length() - KEYWORD.length(); i++) {
            if (line.regionMatches(true, i, KEYWORD, 0, KEYWORD.length())) {
                return true;
            }
        }
        return false;
    }

    private List<Keyword> findKeywords(String line) {
        List<Keyword> keywords = new ArrayList<>();
        int length = KEYWORD.length();
        for (int i = 0; i <= line.length() - length; i++) {
            if (!line.regionMatches(true, i, KEYWORD, 0, length)
                    || (i > 0 && isWordChar(line.charAt(i - 1)))
                    || (i + length < line.length() && isWordChar(line.charAt(i + length)))) {
                continue;
            }
            int index = skipWhitespace(line, i + length);
            boolean colon = index < line.length() && line.charAt(index) == ':';
            if (colon) {
                index = skipWhitespace(line, index + 1);
            }
            boolean uppercase = line.startsWith(KEYWORD, i);
            boolean separated = colon || (i + length < line.length() && Character.isWhitespace(line.charAt(i + length)));
            if (!separated || (!uppercase && !colon)) {
                continue;
            }
            keywords.add(new Keyword(i, index));
            i = index - 1;
        }
        return keywords;
    }

    private Optional<LinkAnchorInfo> parseBody(String line, Keyword keyword, int bodyEnd) {
        int start = keyword.bodyStart();
        int end = trimBodyEnd(line, start, bodyEnd);
        if (end <= start) {
            return Optional.empty();
        }
        String body = line.substring(start, end);

        if (body.charAt(0) == '#') {
            int anchorEnd = 1;
            while (anchorEnd < body.length() && !Character.isWhitespace(body.charAt(anchorEnd))) {
                anchorEnd++;
            }
            if (anchorEnd == 1) {
                return Optional.empty();
            }
            return Optional.of(new LinkAnchorInfo(keyword.start(), start + anchorEnd - keyword.start(), start, anchorEnd,
                    Optional.empty(), true, Optional.of(body.substring(1, anchorEnd)), Optional.empty(), Optional.empty()));
        }

        String target = trimTrailingPunctuation(body.substring(0, targetLength(body)));
        Target parsed = parseTarget(target);
        if (parsed.path().isEmpty() && parsed.anchor().isEmpty()) {
            return Optional.empty();
        }
        // an ignored descending range stays outside the target as literal text
        int length = parsed.anchor().isEmpty() ? target.length() - parsed.ignoredRange() : target.length();
        return Optional.of(new LinkAnchorInfo(keyword.start(), start + length - keyword.start(),
                start, length,
                parsed.path().isEmpty() ? Optional.empty() : Optional.of(parsed.path()),
                parsed.path().isEmpty(),
                parsed.anchor(), parsed.line(), parsed.endLine()));
    }

    /**
     * Drops trailing whitespace and a trailing comment closer from the body.
     */
    private static int trimBodyEnd(String line, int start, int end) {
        int index = end;
        while (index > start && Character.isWhitespace(line.charAt(index - 1))) {
            index--;
        }
        String body = line.substring(start, index);
        for (String closer : List.of("*/", "-->")) {
            if (body.endsWith(closer)) {
                index -= closer.length();
                while (index > start && Character.isWhitespace(line.charAt(index - 1))) {
                    index--;
                }
                break;
            }
        }
        return index;
    }

    /**
     * The target runs word by word up to the first word that looks like a file reference.
     */
    private static int targetLength(String body) {
        int index = 0;
        while (index < body.length()) {
            int wordEnd = index;
            while (wordEnd < body.length() && !Character.isWhitespace(body.charAt(wordEnd))) {
                wordEnd++;
            }
            if (isReference(body.substring(index, wordEnd))) {
                return wordEnd;
            }
            index = skipWhitespace(body, wordEnd);
        }
        return body.length();
    }

    private static String trimTrailingPunctuation(String target) {
        String result = target;
        while (result.length() > 1 && TRAILING_PUNCTUATION.indexOf(result.charAt(result.length() - 1)) >= 0) {
            String remainder = result.substring(0, result.length() - 1);
            if (!isReference(remainder)) {
                break;
            }
            result = remainder;
        }
        return result;
    }

    private static boolean isReference(String text) {
        String word = text;
        while (!word.isEmpty() && TRAILING_PUNCTUATION.indexOf(word.charAt(word.length() - 1)) >= 0) {
            word = word.substring(0, word.length() - 1);
        }
        Target target = parseTarget(word);
        return target.anchor().isPresent() || target.line().isPresent() || hasExtension(target.path());
    }

    private static Target parseTarget(String target) {
        String pathPart = target;
        Optional<String> anchor = Optional.empty();
        int hash = target.indexOf('#');
        if (hash >= 0 && hash + 1 < target.length()) {
            pathPart = target.substring(0, hash);
            anchor = Optional.of(target.substring(hash + 1));
        }

        Optional<Integer> line = Optional.empty();
        Optional<Integer> endLine = Optional.empty();
        int ignoredRange = 0;
        Matcher matcher = LINE_SUFFIX.matcher(pathPart);
        if (matcher.matches()) {
            Optional<Integer> start = parsePositive(matcher.group(2));
            if (start.isPresent()) {
                pathPart = matcher.group(1);
                line = start;
                Optional<Integer> end = matcher.group(3) == null ? Optional.empty() : parsePositive(matcher.group(3));
                if (end.isPresent() && end.get() > start.get()) {
                    endLine = end;
                } else if (matcher.group(3) != null) {
                    ignoredRange = matcher.group(3).length() + 1;
                }
            }
        }
        return new Target(pathPart.strip(), line, endLine, anchor, ignoredRange);
    }

    private static Optional<Integer> parsePositive(String digits) {
        try {
            int value = Integer.parseInt(digits);
            return value >= 1 ? Optional.of(value) : Optional.empty();
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static boolean hasExtension(String path) {
        int segmentStart = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\')) + 1;
        int dot = path.lastIndexOf('.');
        if (dot <= segmentStart || dot == path.length() - 1) {
            return false;
        }
        for (int i = dot + 1; i < path.length(); i++) {
            if (!Character.isLetterOrDigit(path.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static boolean isWordChar(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_';
    }

    private static int skipWhitespace(String text, int from) {
        int index = from;
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    private record Keyword(int start, int bodyStart) {
    }

    private record Target(String path, Optional<Integer> line, Optional<Integer> endLine, Optional<String> anchor,
                          int ignoredRange) {
    }
}
