package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.config.RenderProperties;
import github.sarthakdev143.reel_factory.model.FitPlacement;
import github.sarthakdev143.reel_factory.model.RenderJob;
import github.sarthakdev143.reel_factory.model.RenderResult;
import github.sarthakdev143.reel_factory.model.VideoProbe;
import github.sarthakdev143.reel_factory.model.composition.CompositionTimeline;
import github.sarthakdev143.reel_factory.service.RenderPipeline;
import github.sarthakdev143.reel_factory.service.TimelineEncoder;
import github.sarthakdev143.reel_factory.service.VideoNormalizer;
import github.sarthakdev143.reel_factory.service.VideoProber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

@Service
public class DefaultRenderPipeline implements RenderPipeline {

    private static final Logger logger = LoggerFactory.getLogger(DefaultRenderPipeline.class);

    private final VideoNormalizer normalizer;
    private final VideoProber prober;
    private final CanvasFitter canvasFitter;
    private final OverlayCompositor compositor;
    private final TimelineEncoder encoder;
    private final RenderProperties properties;

    public DefaultRenderPipeline(
            VideoNormalizer normalizer,
            VideoProber prober,
            CanvasFitter canvasFitter,
            OverlayCompositor compositor,
            TimelineEncoder encoder,
            RenderProperties properties) {
        this.normalizer = normalizer;
        this.prober = prober;
        this.canvasFitter = canvasFitter;
        this.compositor = compositor;
        this.encoder = encoder;
        this.properties = properties;
    }

    @Override
    public RenderResult render(RenderJob job) throws IOException, InterruptedException {
        Path source = job.sourceVideo();
        if (!Files.isRegularFile(source)) {
            throw new IOException("Source video not found: " + source);
        }

        Files.createDirectories(properties.getWorkDir());
        Path workDir = Files.createTempDirectory(properties.getWorkDir(), "job-" + job.jobId() + "-");
        Path usable = null;

        try {
            VideoProbe sourceProbe = prober.probe(source);
            usable = normalizer.normalize(source);
            VideoProbe usableProbe = usable.equals(source) ? sourceProbe : prober.probe(usable);

            // geometry and audio come from the file being composited, duration from the original upload
            VideoProbe probe = new VideoProbe(
                    usableProbe.width(),
                    usableProbe.height(),
                    sourceProbe.durationSeconds(),
                    usableProbe.frameRate(),
                    usableProbe.hasAudio());

            FitPlacement placement = canvasFitter.fit(probe.width(), probe.height(), job.canvas());
            logger.info(
                    "Render job {}: source {}x{} -> {}x{} at ({}, {}) on {}x{}",
                    job.jobId(),
                    probe.width(),
                    probe.height(),
                    placement.placedWidth(),
                    placement.placedHeight(),
                    placement.offsetX(),
                    placement.offsetY(),
                    job.canvas().width(),
                    job.canvas().height());

            CompositionTimeline timeline = compositor.compose(usable, probe, placement, job, workDir);

            Files.createDirectories(properties.getOutputDir());
            Path outputPath = properties.getOutputDir().resolve(job.jobId() + ".mp4");
            double duration = encoder.encode(timeline, outputPath);
            return new RenderResult(outputPath, duration);
        } finally {
            if (usable != null && !usable.equals(source)) {
                deleteIfExists(usable);
            }
            deleteRecursively(workDir);
        }
    }

    private void deleteRecursively(Path directory) {
        if (directory == null || Files.notExists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(this::deleteIfExists);
        } catch (IOException e) {
            logger.warn("Could not clean up work directory {}", directory, e);
        }
    }

    private void deleteIfExists(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete {}", path, e);
        }
    }
}
