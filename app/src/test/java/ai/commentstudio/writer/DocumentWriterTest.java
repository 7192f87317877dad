package ai.commentstudio.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesLinesAndCreatesDirectories() throws Exception {
        DocumentWriter writer = new DocumentWriter(false);
        Path target = tempDir.resolve("src/nested/Sample.cs");

        writer.write(new SourceDocument(target, List.of("a", "b"), "\n", true));

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("a\nb\n");
    }

    @Test
    void keepsLineSeparatorAndFinalNewline() {
        SourceDocument crlf = SourceDocument.parse(tempDir.resolve("A.cs"), "a\r\nb\r\n");
        SourceDocument bare = SourceDocument.parse(tempDir.resolve("B.cs"), "x\ny");

        assertThat(crlf.lines()).containsExactly("a", "b");
        assertThat(crlf.withLines(List.of("c")).render()).isEqualTo("c\r\n");
        assertThat(bare.trailingNewline()).isFalse();
        assertThat(bare.render()).isEqualTo("x\ny");
    }

    @Test
    void stagesWrittenFileWhenRepositoryExists() throws Exception {
        try (Git git = Git.init().setDirectory(tempDir.toFile()).call()) {
            DocumentWriter writer = new DocumentWriter(true);

            writer.write(new SourceDocument(tempDir.resolve("src/Sample.cs"), List.of("class Sample { }"), "\n", true));

            assertThat(git.status().call().getAdded()).contains("src/Sample.cs");
        }
    }

    @Test
    void readingMissingFileFails() {
        Throwable thrown = catchThrowable(() -> SourceDocument.read(tempDir.resolve("missing.cs")));

        assertThat(thrown).isInstanceOf(UncheckedIOException.class).hasMessageContaining("missing.cs");
    }
}
