package github.sarthakdev143.reel_factory.integration.video;

import github.sarthakdev143.reel_factory.config.RenderProperties;
import github.sarthakdev143.reel_factory.service.VideoNormalizer;
import github.sarthakdev143.reel_factory.util.FirstSuccess;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-encodes arbitrary uploads into H.264/yuv420p/AAC at a fixed frame rate before compositing.
 * Any failure leaves the original file in place.
 */
@Component
public class FfmpegVideoNormalizer implements VideoNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegVideoNormalizer.class);

    private final ProcessRunner processRunner;
    private final RenderProperties properties;
    private final Counter fallbackCounter;

    public FfmpegVideoNormalizer(ProcessRunner processRunner, RenderProperties properties, MeterRegistry meterRegistry) {
        this.processRunner = processRunner;
        this.properties = properties;
        this.fallbackCounter = meterRegistry.counter("reel_factory.normalization.fallbacks");
    }

    @Override
    public Path normalize(Path sourcePath) throws InterruptedException {
        Path normalizedPath;
        try {
            Files.createDirectories(properties.getWorkDir());
            normalizedPath = Files.createTempFile(properties.getWorkDir(), "normalized-", ".mp4");
        } catch (IOException e) {
            return fallBack(sourcePath, null, "could not create temp file: " + e.getMessage());
        }

        FirstSuccess.Outcome<String, String> outcome = FirstSuccess.tryInOrder(
                properties.getVideoEncoders(),
                encoder -> processRunner.run(
                        buildNormalizeCommand(sourcePath, normalizedPath, encoder),
                        "normalize with " + encoder));

        if (!outcome.succeeded()) {
            return fallBack(sourcePath, normalizedPath, outcome.describeFailures());
        }
        if (!isUsable(normalizedPath)) {
            return fallBack(sourcePath, normalizedPath, "transcode produced no output");
        }

        logger.info("Normalized {} with encoder {}", sourcePath.getFileName(), outcome.candidate());
        return normalizedPath;
    }

    List<String> buildNormalizeCommand(Path sourcePath, Path outputPath, String videoEncoder) {
        List<String> command = new ArrayList<>();
        command.add(properties.getFfmpegPath());
        command.add("-y");
        command.add("-i");
        command.add(sourcePath.toString());
        command.add("-map");
        command.add("0:v:0");
        command.add("-map");
        command.add("0:a:0?");
        command.add("-c:v");
        command.add(videoEncoder);
        if ("libx264".equals(videoEncoder)) {
            command.add("-preset");
            command.add("veryfast");
            command.add("-crf");
            command.add("20");
        }
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-r");
        command.add(String.valueOf(properties.getNormalizeFrameRate()));
        command.add("-c:a");
        command.add("aac");
        command.add("-ar");
        command.add(String.valueOf(properties.getAudioSampleRate()));
        command.add("-ac");
        command.add("2");
        command.add("-movflags");
        command.add("+faststart");
        command.add(outputPath.toString());
        return command;
    }

    private boolean isUsable(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            return false;
        }
    }

    private Path fallBack(Path sourcePath, Path normalizedPath, String reason) {
        fallbackCounter.increment();
        logger.warn("Normalization of {} failed, using original file: {}", sourcePath.getFileName(), reason);
        deleteIfExists(normalizedPath);
        return sourcePath;
    }

    private void deleteIfExists(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not delete {}", path, e);
        }
    }
}
