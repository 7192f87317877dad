package ai.commentstudio.cli;

import ai.commentstudio.config.Config;
import ai.commentstudio.config.ConfigLoader;
import ai.commentstudio.config.EnvironmentReader;
import ai.commentstudio.export.TagExporter;
import ai.commentstudio.link.LinkAnchorInfo;
import ai.commentstudio.link.LinkAnchorTokenizer;
import ai.commentstudio.logging.LoggingConfigurator;
import ai.commentstudio.style.CommentStyle;
import ai.commentstudio.style.CommentStyleCatalog;
import ai.commentstudio.tag.TagOccurrence;
import ai.commentstudio.tag.TagScanner;
import ai.commentstudio.writer.DocumentReflower;
import ai.commentstudio.writer.DocumentWriter;
import ai.commentstudio.writer.ReflowOutcome;
import ai.commentstudio.writer.SourceDocument;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and the comment tools.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CHANGES_PENDING = 1;

    private final ConfigLoader configLoader;
    private final DocumentWriter documentWriter;
    private final PrintWriter out;
    private final PrintWriter err;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new DocumentWriter(),
                new PrintWriter(System.out, true, StandardCharsets.UTF_8),
                new PrintWriter(System.err, true, StandardCharsets.UTF_8));
    }

    CliApplication(ConfigLoader configLoader, DocumentWriter documentWriter, PrintWriter out, PrintWriter err) {
        this.configLoader = configLoader;
        this.documentWriter = documentWriter;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);
        commandLine.setOut(out);
        commandLine.setErr(err);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            if (commandLine.isUsageHelpRequested()) {
                commandLine.usage(commandLine.getOut());
                return commandLine.getCommandSpec().exitCodeOnUsageHelp();
            }
            return invalidInput(commandLine, ex.getMessage());
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            return invalidInput(commandLine, ex.getMessage());
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Running {} on {} file(s)", config.command().cliName(), config.files().size());

        int exitCode = switch (config.command()) {
            case REFLOW -> reflow(config);
            case TAGS -> tags(config);
            case LINKS -> links(config);
        };
        out.flush();
        return exitCode;
    }

    private int invalidInput(CommandLine commandLine, String message) {
        commandLine.getErr().println(message);
        commandLine.usage(commandLine.getErr());
        return commandLine.getCommandSpec().exitCodeOnInvalidInput();
    }

    private int reflow(Config config) {
        DocumentReflower reflower = new DocumentReflower();
        int pending = 0;
        for (Path file : config.files()) {
            Optional<CommentStyle> style = config.style().or(() -> CommentStyleCatalog.forFileName(file.getFileName().toString()));
            if (style.isEmpty()) {
                LOGGER.warn("Skipping {}: no documentation comment style for this file type", file);
                continue;
            }
            Optional<SourceDocument> document = read(file);
            if (document.isEmpty()) {
                continue;
            }
            ReflowOutcome outcome = reflower.reflow(document.get().lines(), style.get(), config.reflowConfig());
            if (!outcome.changed()) {
                LOGGER.debug("{} is already formatted", file);
                continue;
            }
            if (config.write()) {
                documentWriter.write(document.get().withLines(outcome.lines()));
                LOGGER.info("Reflowed {} comment block(s) in {}", outcome.changedBlocks().size(), file);
            } else {
                for (int startLine : outcome.changedBlocks()) {
                    out.printf("%s:%d: documentation comment would be reflowed%n", file, startLine + 1);
                }
                pending += outcome.changedBlocks().size();
            }
        }
        if (pending > 0) {
            LOGGER.info("{} comment block(s) need reflowing; run with --write to apply", pending);
            return EXIT_CHANGES_PENDING;
        }
        return EXIT_OK;
    }

    private int tags(Config config) {
        TagScanner scanner = new TagScanner(config.customTags());
        List<TagOccurrence> occurrences = new ArrayList<>();
        for (Path file : config.files()) {
            read(file).ifPresent(document -> occurrences.addAll(scanner.scan(file.toString(), document.lines())));
        }
        LOGGER.info("Found {} tag(s)", occurrences.size());
        out.print(new TagExporter().export(occurrences, config.exportFormat()));
        return EXIT_OK;
    }

    private int links(Config config) {
        LinkAnchorTokenizer tokenizer = new LinkAnchorTokenizer();
        int count = 0;
        for (Path file : config.files()) {
            Optional<SourceDocument> document = read(file);
            if (document.isEmpty()) {
                continue;
            }
            List<String> lines = document.get().lines();
            for (int i = 0; i < lines.size(); i++) {
                for (LinkAnchorInfo link : tokenizer.parse(lines.get(i))) {
                    out.printf("%s:%d:%d: %s%n", file, i + 1, link.targetStart() + 1, link.describeTarget());
                    count++;
                }
            }
        }
        LOGGER.info("Found {} LINK reference(s)", count);
        return EXIT_OK;
    }

    private Optional<SourceDocument> read(Path file) {
        try {
            return Optional.of(SourceDocument.read(file));
        } catch (UncheckedIOException ex) {
            LOGGER.warn("Skipping {}: {}", file, ex.getCause().getMessage());
            return Optional.empty();
        }
    }
}
