package github.sarthakdev143.reel_factory.integration.video;

import github.sarthakdev143.reel_factory.config.RenderProperties;
import github.sarthakdev143.reel_factory.model.FitPlacement;
import github.sarthakdev143.reel_factory.model.composition.CompositionTimeline;
import github.sarthakdev143.reel_factory.model.composition.OverlayLayer;
import github.sarthakdev143.reel_factory.model.composition.PanelPlan;
import github.sarthakdev143.reel_factory.service.EncodingException;
import github.sarthakdev143.reel_factory.service.RenderFailureException;
import github.sarthakdev143.reel_factory.service.TimelineEncoder;
import github.sarthakdev143.reel_factory.util.FirstSuccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Component
public class FfmpegTimelineEncoder implements TimelineEncoder {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegTimelineEncoder.class);

    private final ProcessRunner processRunner;
    private final RenderProperties properties;

    public FfmpegTimelineEncoder(ProcessRunner processRunner, RenderProperties properties) {
        this.processRunner = processRunner;
        this.properties = properties;
    }

    @Override
    public double encode(CompositionTimeline timeline, Path outputPath) throws IOException, InterruptedException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        FirstSuccess.Outcome<String, String> outcome = FirstSuccess.tryInOrder(
                properties.getVideoEncoders(),
                encoder -> {
                    Files.deleteIfExists(outputPath);
                    return processRunner.run(
                            buildEncodeCommand(timeline, outputPath, encoder),
                            "encode with " + encoder);
                });

        if (!outcome.succeeded()) {
            Files.deleteIfExists(outputPath);
            EncodingException failure = new EncodingException(
                    "All video encoders failed: " + outcome.describeFailures());
            outcome.failures().forEach(attempt -> failure.addSuppressed(attempt.error()));
            throw failure;
        }

        if (!Files.isRegularFile(outputPath) || Files.size(outputPath) == 0) {
            throw new RenderFailureException("Encoder produced no output at " + outputPath);
        }

        logger.info(
                "Encoded {} with {} ({}s, {} fps, audio={})",
                outputPath.getFileName(),
                outcome.candidate(),
                formatSeconds(timeline.durationSec()),
                timeline.frameRate(),
                timeline.hasAudio());
        return timeline.durationSec();
    }

    List<String> buildEncodeCommand(CompositionTimeline timeline, Path outputPath, String videoEncoder) {
        String duration = formatSeconds(timeline.durationSec());
        String frameRate = String.valueOf(timeline.frameRate());
        int bitrate = properties.getVideoBitrateKbps();

        List<String> command = new ArrayList<>();
        command.add(properties.getFfmpegPath());
        command.add("-y");
        command.add("-i");
        command.add(timeline.videoPath().toString());
        addStillImageInput(command, timeline.caption(), frameRate, duration);
        addStillImageInput(command, timeline.credits(), frameRate, duration);

        command.add("-filter_complex");
        command.add(buildFilterGraph(timeline));
        command.add("-map");
        command.add("[v]");

        if (timeline.hasAudio()) {
            command.add("-map");
            command.add("0:a:0?");
            command.add("-c:a");
            command.add("aac");
            command.add("-b:a");
            command.add(properties.getAudioBitrateKbps() + "k");
        } else {
            command.add("-an");
        }

        command.add("-c:v");
        command.add(videoEncoder);
        if ("libx264".equals(videoEncoder)) {
            command.add("-preset");
            command.add("veryfast");
        }
        command.add("-b:v");
        command.add(bitrate + "k");
        command.add("-maxrate");
        command.add(bitrate + "k");
        command.add("-bufsize");
        command.add((bitrate * 2) + "k");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-r");
        command.add(frameRate);
        command.add("-t");
        command.add(duration);
        command.add("-movflags");
        command.add("+faststart");
        command.add(outputPath.toString());
        return command;
    }

    String buildFilterGraph(CompositionTimeline timeline) {
        FitPlacement placement = timeline.placement();
        PanelPlan panel = timeline.panel();
        OverlayLayer caption = timeline.caption();
        OverlayLayer credits = timeline.credits();

        return "color=c=" + timeline.backgroundColor()
                + ":s=" + timeline.canvas().width() + "x" + timeline.canvas().height()
                + ":r=" + timeline.frameRate()
                + ":d=" + formatSeconds(timeline.durationSec()) + "[bg];"
                + "[0:v]scale=" + placement.placedWidth() + ":" + placement.placedHeight() + ",setsar=1[fg];"
                + "[bg][fg]overlay=" + placement.offsetX() + ":" + placement.offsetY() + "[base];"
                + "[base]drawbox=x=" + panel.x()
                + ":y=" + panel.y()
                + ":w=" + panel.width()
                + ":h=" + panel.height()
                + ":color=" + panel.color() + "@" + formatDecimal(panel.opacity())
                + ":t=fill[panel];"
                + "[panel][1:v]overlay=" + caption.x() + ":" + caption.y() + "[captioned];"
                + "[captioned][2:v]overlay=" + credits.x() + ":" + credits.y() + ",format=yuv420p[v]";
    }

    private void addStillImageInput(List<String> command, OverlayLayer layer, String frameRate, String duration) {
        command.add("-loop");
        command.add("1");
        command.add("-framerate");
        command.add(frameRate);
        command.add("-t");
        command.add(duration);
        command.add("-i");
        command.add(layer.imagePath().toString());
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    private String formatDecimal(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
