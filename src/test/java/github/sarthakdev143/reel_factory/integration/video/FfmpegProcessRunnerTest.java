package github.sarthakdev143.reel_factory.integration.video;

import github.sarthakdev143.reel_factory.config.RenderProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@EnabledOnOs({OS.LINUX, OS.MAC})
class FfmpegProcessRunnerTest {

    @Test
    void returnsCombinedOutputOnSuccess() throws Exception {
        FfmpegProcessRunner runner = new FfmpegProcessRunner(propertiesWithTimeout(Duration.ofSeconds(10)));

        String output = runner.run(List.of("sh", "-c", "echo hello; echo warning 1>&2"), "echo");

        assertThat(output).contains("hello").contains("warning");
    }

    @Test
    void nonZeroExitFailsWithExitCodeAndOutputTail() {
        FfmpegProcessRunner runner = new FfmpegProcessRunner(propertiesWithTimeout(Duration.ofSeconds(10)));

        assertThatThrownBy(() -> runner.run(List.of("sh", "-c", "echo boom; exit 3"), "encode with libx264"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("encode with libx264")
                .hasMessageContaining("exit code 3")
                .hasMessageContaining("boom");
    }

    @Test
    void processExceedingTimeoutIsKilledPromptly() {
        FfmpegProcessRunner runner = new FfmpegProcessRunner(propertiesWithTimeout(Duration.ofMillis(500)));

        long startedAt = System.nanoTime();
        assertThatThrownBy(() -> runner.run(List.of("sleep", "10"), "normalize with libx264"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("timed out")
                .hasMessageContaining("normalize with libx264");
        long elapsedMillis = Duration.ofNanos(System.nanoTime() - startedAt).toMillis();

        assertThat(elapsedMillis).isLessThan(5000);
    }

    @Test
    void missingBinaryFailsWithIoException() {
        FfmpegProcessRunner runner = new FfmpegProcessRunner(propertiesWithTimeout(Duration.ofSeconds(10)));

        assertThatThrownBy(() -> runner.run(List.of("/nonexistent/bin/ffmpeg", "-version"), "preflight"))
                .isInstanceOf(IOException.class);
    }

    private static RenderProperties propertiesWithTimeout(Duration timeout) {
        RenderProperties properties = new RenderProperties();
        properties.setProcessTimeout(timeout);
        return properties;
    }
}
