package github.sarthakdev143.reel_factory.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "reel-factory.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final int TOOL_CHECK_TIMEOUT_SECONDS = 10;

    private final RenderProperties properties;

    public StartupPreflightChecks(RenderProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkToolAvailable("FFmpeg", properties.getFfmpegPath(), "reel-factory.render.ffmpeg-path");
        checkToolAvailable("FFprobe", properties.getFfprobePath(), "reel-factory.render.ffprobe-path");
        checkWritableDirectory(properties.getWorkDir());
        checkWritableDirectory(properties.getOutputDir());
    }

    private void checkToolAvailable(String toolName, String binary, String propertyName) {
        if (binary == null || binary.isBlank()) {
            throw new IllegalStateException(toolName + " binary is not configured. Set " + propertyName + ".");
        }

        try {
            Process process = new ProcessBuilder(binary, "-version")
                    .redirectErrorStream(true)
                    .start();
            process.getInputStream().transferTo(OutputStream.nullOutputStream());
            boolean finished = process.waitFor(TOOL_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
            }
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        toolName + " is not available at " + binary + ". Install it or set " + propertyName + ".");
            }
            logger.info("{} found at {}", toolName, binary);
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    toolName + " is not available at " + binary + ". Install it or set " + propertyName + ".",
                    e);
        }
    }

    private void checkWritableDirectory(Path directory) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to create directory " + directory.toAbsolutePath() + ".", e);
        }
        if (!Files.isWritable(directory)) {
            throw new IllegalStateException("Directory is not writable: " + directory.toAbsolutePath() + ".");
        }
    }
}
