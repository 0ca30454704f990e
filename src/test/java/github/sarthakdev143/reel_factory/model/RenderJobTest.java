package github.sarthakdev143.reel_factory.model;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RenderJobTest {

    private static final Path SOURCE = Path.of("source.mp4");

    @Test
    void padsSingleLineToThreeLines() {
        RenderJob job = new RenderJob("job-1", SOURCE, List.of("Only line"), "credits");

        assertThat(job.overlayLines()).containsExactly("Only line", "", "");
    }

    @Test
    void truncatesTenLinesToSix() {
        List<String> lines = IntStream.rangeClosed(1, 10).mapToObj(i -> "line " + i).toList();

        RenderJob job = new RenderJob("job-1", SOURCE, lines, "credits");

        assertThat(job.overlayLines()).containsExactly("line 1", "line 2", "line 3", "line 4", "line 5", "line 6");
    }

    @Test
    void nullLinesBecomeBlanksAndNullListIsPadded() {
        RenderJob withNulls = new RenderJob("job-1", SOURCE, Arrays.asList("a", null, "  c  ", "d"), null);
        RenderJob withoutLines = new RenderJob("job-2", SOURCE, null, null);

        assertThat(withNulls.overlayLines()).containsExactly("a", "", "c", "d");
        assertThat(withNulls.credits()).isEmpty();
        assertThat(withoutLines.overlayLines()).containsExactly("", "", "");
    }

    @Test
    void defaultsCanvasToPortraitHd() {
        RenderJob job = new RenderJob("job-1", SOURCE, List.of("a"), "c");

        assertThat(job.canvas()).isEqualTo(new CanvasSpec(1080, 1920));
        assertThat(job.canvas().isPortrait()).isTrue();
    }

    @Test
    void overlayTextJoinsLinesWithHardBreaks() {
        RenderJob job = new RenderJob("job-1", SOURCE, List.of("first", "second", "third"), "");

        assertThat(job.overlayText()).isEqualTo("first\nsecond\nthird");
    }

    @Test
    void rejectsMissingIdentifierOrSource() {
        assertThatThrownBy(() -> new RenderJob(" ", SOURCE, List.of("a"), ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("jobId");
        assertThatThrownBy(() -> new RenderJob("job-1", null, List.of("a"), ""))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sourceVideo");
    }

    @Test
    void canvasRejectsOutOfRangeAndOddDimensions() {
        assertThatThrownBy(() -> new CanvasSpec(0, 1920)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CanvasSpec(1080, 8192)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CanvasSpec(1081, 1920))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("even");
    }
}
