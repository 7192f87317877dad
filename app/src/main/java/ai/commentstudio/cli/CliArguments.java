package ai.commentstudio.cli;

import ai.commentstudio.config.Command;
import ai.commentstudio.config.LogFormat;
import ai.commentstudio.export.ExportFormat;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "comment-studio", mixinStandardHelpOptions = true, version = "comment-studio 0.1.0",
        description = "Reflows documentation comments and lists tag and LINK comments")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "1", converter = CommandConverter.class, paramLabel = "COMMAND",
            description = "reflow, tags or links")
    private Command command;

    @CommandLine.Parameters(index = "1..*", arity = "1..*", paramLabel = "FILE", description = "Source files to process")
    private List<Path> files = new ArrayList<>();

    @CommandLine.Option(names = "--write", description = "Rewrite files instead of reporting comments that would change")
    private boolean write;

    @CommandLine.Option(names = "--max-line-length", paramLabel = "N", description = "Maximum line length (default 120)")
    private Integer maxLineLength;

    @CommandLine.Option(names = "--compact", negatable = true, description = "Collapse short elements onto one line")
    private Boolean compact;

    @CommandLine.Option(names = "--preserve-blank-lines", negatable = true, description = "Keep blank lines between paragraphs")
    private Boolean preserveBlankLines;

    @CommandLine.Option(names = "--custom-tags", paramLabel = "TAGS", description = "Comma separated tags in addition to TODO, HACK, NOTE, ...")
    private String customTags;

    @CommandLine.Option(names = "--format", converter = ExportFormatConverter.class, description = "Tag export format: tsv, csv, markdown or json")
    private ExportFormat exportFormat;

    @CommandLine.Option(names = "--language", paramLabel = "ID", description = "Comment style for all files: csharp, vb, cpp, fsharp, typescript or javascript")
    private String language;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    public Command command() {
        return command;
    }

    public List<Path> files() {
        return files;
    }

    public boolean write() {
        return write;
    }

    public Integer maxLineLength() {
        return maxLineLength;
    }

    public Boolean compact() {
        return compact;
    }

    public Boolean preserveBlankLines() {
        return preserveBlankLines;
    }

    public String customTags() {
        return customTags;
    }

    public ExportFormat exportFormat() {
        return exportFormat;
    }

    public String language() {
        return language;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
