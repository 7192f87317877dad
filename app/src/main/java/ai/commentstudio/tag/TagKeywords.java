package ai.commentstudio.tag;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tag keyword lists.
 */
public final class TagKeywords {

    public static final List<String> BUILT_IN = List.of("TODO", "HACK", "NOTE", "BUG", "FIXME", "UNDONE", "REVIEW", "ANCHOR");

    public static final String ANCHOR = "ANCHOR";

    private TagKeywords() {
    }

    /**
     * Parses a comma separated list such as {@code PERF, SECURITY}; blanks are skipped.
     */
    public static List<String> parseList(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String> tags = new ArrayList<>();
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) {
                tags.add(trimmed);
            }
        }
        return merge(tags, List.of());
    }

    /**
     * Concatenates both lists, dropping blanks and case-insensitive duplicates. The first spelling wins.
     */
    public static List<String> merge(Collection<String> knownTags, Collection<String> customTags) {
        Set<String> seen = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        List<String> merged = new ArrayList<>();
        for (Collection<String> source : List.of(safe(knownTags), safe(customTags))) {
            for (String tag : source) {
                if (tag != null && !tag.isBlank() && seen.add(tag.strip())) {
                    merged.add(tag.strip());
                }
            }
        }
        return List.copyOf(merged);
    }

    static String normalize(String tag) {
        return tag.toLowerCase(Locale.ROOT);
    }

    private static Collection<String> safe(Collection<String> tags) {
        return tags == null ? List.of() : tags;
    }
}
