package ai.commentstudio.config;

import java.util.Locale;

/**
 * Sub-command selected on the command line.
 */
public enum Command {
    /** Check or rewrite documentation comments. */
    REFLOW,
    /** List tag comments such as TODO or HACK. */
    TAGS,
    /** List LINK references. */
    LINKS;

    public static Command from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Command must be provided");
        }
        for (Command command : values()) {
            if (command.name().equalsIgnoreCase(raw.trim())) {
                return command;
            }
        }
        throw new IllegalArgumentException("Unsupported command: " + raw);
    }

    public String cliName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
