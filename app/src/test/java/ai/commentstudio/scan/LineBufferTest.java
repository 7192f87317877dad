package ai.commentstudio.scan;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class LineBufferTest {

    @Test
    void splitsOnEveryLineBreakStyle() {
        LineBuffer buffer = LineBuffer.of("a\r\nbb\rc\n");

        assertThat(buffer.lines()).containsExactly("a", "bb", "c", "");
        assertThat(buffer.lineStart(1)).isEqualTo(2);
        assertThat(buffer.lineStart(2)).isEqualTo(5);
        assertThat(buffer.lineStart(3)).isEqualTo(7);
        assertThat(buffer.length()).isEqualTo(7);
    }

    @Test
    void mapsOffsetsToLines() {
        LineBuffer buffer = LineBuffer.of("a\r\nbb\rc\n");

        assertThat(buffer.lineAt(0)).isZero();
        assertThat(buffer.lineAt(1)).isZero();
        assertThat(buffer.lineAt(2)).isEqualTo(1);
        assertThat(buffer.lineAt(7)).isEqualTo(3);
        assertThat(buffer.lineAt(8)).isEqualTo(-1);
        assertThat(buffer.lineAt(-1)).isEqualTo(-1);
    }

    @Test
    void emptyTextHasNoLines() {
        LineBuffer buffer = LineBuffer.of("");

        assertThat(buffer.lineCount()).isZero();
        assertThat(buffer.lineAt(0)).isEqualTo(-1);
    }
}
