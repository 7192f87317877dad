package ai.commentstudio.writer;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes reflowed documents back to disk and stages them when they belong to a git working tree.
 */
public class DocumentWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentWriter.class);

    private final boolean stageChanges;

    public DocumentWriter() {
        this(true);
    }

    public DocumentWriter(boolean stageChanges) {
        this.stageChanges = stageChanges;
    }

    public void write(SourceDocument document) {
        Objects.requireNonNull(document, "document");
        Path target = document.path();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, document.render(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            if (stageChanges) {
                stageIfRepository(target);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write document: " + target, ex);
        }
    }

    private void stageIfRepository(Path target) throws IOException {
        Path file = target.toRealPath();
        FileRepositoryBuilder builder = new FileRepositoryBuilder().findGitDir(file.getParent().toFile());
        if (builder.getGitDir() == null) {
            return;
        }
        try (Repository repository = builder.setMustExist(true).build()) {
            if (repository.isBare()) {
                return;
            }
            File workTree = repository.getWorkTree();
            String relativePath = workTree.toPath().toRealPath().relativize(file).toString().replace('\\', '/');
            try (Git git = new Git(repository)) {
                git.add().addFilepattern(relativePath).call();
            }
            LOGGER.debug("Staged {}", relativePath);
        } catch (GitAPIException ex) {
            throw new IllegalStateException("Failed to stage document: " + target, ex);
        }
    }
}
