package ai.commentstudio.tag;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the tag occurrences of a whole document.
 */
public class TagScanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(TagScanner.class);

    private final TagTokenizer tokenizer;
    private final List<String> tags;

    public TagScanner(List<String> customTags) {
        this(new TagTokenizer(), TagKeywords.BUILT_IN, customTags);
    }

    public TagScanner(TagTokenizer tokenizer, List<String> knownTags, List<String> customTags) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.tags = TagKeywords.merge(knownTags, customTags);
    }

    public List<String> tags() {
        return tags;
    }

    public List<TagOccurrence> scan(String filePath, List<String> lines) {
        Objects.requireNonNull(filePath, "filePath");
        if (lines == null || lines.isEmpty() || !mentionsAnyTag(lines)) {
            return List.of();
        }
        List<TagOccurrence> occurrences = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            for (TagMatch match : tokenizer.parse(lines.get(i), tags, List.of())) {
                occurrences.add(new TagOccurrence(filePath, i + 1, match));
            }
        }
        LOGGER.debug("Found {} tags in {}", occurrences.size(), filePath);
        return List.copyOf(occurrences);
    }

    private boolean mentionsAnyTag(List<String> lines) {
        String document = String.join("\n", lines).toLowerCase(Locale.ROOT);
        return tags.stream().map(TagKeywords::normalize).anyMatch(document::contains);
    }
}
