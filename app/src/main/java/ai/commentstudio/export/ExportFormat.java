package ai.commentstudio.export;

/**
 * Output formats for tag listings.
 */
public enum ExportFormat {
    TSV("tsv"),
    CSV("csv"),
    MARKDOWN("md"),
    JSON("json");

    private final String extension;

    ExportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    public static ExportFormat from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TSV;
        }
        String value = raw.trim();
        for (ExportFormat format : values()) {
            if (format.name().equalsIgnoreCase(value) || format.extension.equalsIgnoreCase(value)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported export format: " + raw);
    }
}
