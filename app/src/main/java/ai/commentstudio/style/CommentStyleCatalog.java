package ai.commentstudio.style;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only table of the documentation comment styles of every supported language.
 */
public final class CommentStyleCatalog {

    public static final CommentStyle CSHARP = new CommentStyle("csharp", "///", "/**", "*/");
    public static final CommentStyle VISUAL_BASIC = CommentStyle.lineOnly("vb", "'''");
    public static final CommentStyle CPP = new CommentStyle("cpp", "///", "/**", "*/");
    public static final CommentStyle FSHARP = CommentStyle.lineOnly("fsharp", "///");
    public static final CommentStyle TYPESCRIPT = CommentStyle.lineOnly("typescript", "///");
    public static final CommentStyle JAVASCRIPT = CommentStyle.lineOnly("javascript", "///");

    private static final List<CommentStyle> ALL = List.of(CSHARP, VISUAL_BASIC, CPP, FSHARP, TYPESCRIPT, JAVASCRIPT);

    private static final Map<String, CommentStyle> BY_EXTENSION = Map.ofEntries(
            Map.entry("cs", CSHARP),
            Map.entry("vb", VISUAL_BASIC),
            Map.entry("c", CPP),
            Map.entry("cc", CPP),
            Map.entry("cpp", CPP),
            Map.entry("cxx", CPP),
            Map.entry("h", CPP),
            Map.entry("hh", CPP),
            Map.entry("hpp", CPP),
            Map.entry("fs", FSHARP),
            Map.entry("fsi", FSHARP),
            Map.entry("fsx", FSHARP),
            Map.entry("ts", TYPESCRIPT),
            Map.entry("tsx", TYPESCRIPT),
            Map.entry("js", JAVASCRIPT),
            Map.entry("jsx", JAVASCRIPT),
            Map.entry("mjs", JAVASCRIPT));

    private CommentStyleCatalog() {
    }

    public static List<CommentStyle> all() {
        return ALL;
    }

    /**
     * Resolves a style from an editor content type name such as {@code CSharp}, {@code Basic} or {@code C/C++}.
     */
    public static Optional<CommentStyle> forContentType(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            return Optional.empty();
        }
        String normalized = contentType.toLowerCase(Locale.ROOT);
        if (normalized.contains("csharp")) {
            return Optional.of(CSHARP);
        }
        if (normalized.contains("basic")) {
            return Optional.of(VISUAL_BASIC);
        }
        if (normalized.contains("c/c++") || normalized.contains("c++")) {
            return Optional.of(CPP);
        }
        if (normalized.contains("f#") || normalized.contains("fsharp")) {
            return Optional.of(FSHARP);
        }
        if (normalized.contains("typescript")) {
            return Optional.of(TYPESCRIPT);
        }
        if (normalized.contains("javascript")) {
            return Optional.of(JAVASCRIPT);
        }
        return Optional.empty();
    }

    public static Optional<CommentStyle> forLanguageId(String languageId) {
        if (languageId == null) {
            return Optional.empty();
        }
        String trimmed = languageId.trim();
        return ALL.stream()
                .filter(style -> style.languageId().equalsIgnoreCase(trimmed))
                .findFirst();
    }

    public static Optional<CommentStyle> forFileName(String fileName) {
        if (fileName == null) {
            return Optional.empty();
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return Optional.empty();
        }
        String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
        return Optional.ofNullable(BY_EXTENSION.get(extension));
    }
}
