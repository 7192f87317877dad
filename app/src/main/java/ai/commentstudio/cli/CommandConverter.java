package ai.commentstudio.cli;

import ai.commentstudio.config.Command;
import picocli.CommandLine;

/**
 * Parses the sub-command positional parameter.
 */
public class CommandConverter implements CommandLine.ITypeConverter<Command> {
    @Override
    public Command convert(String value) {
        return Command.from(value);
    }
}
