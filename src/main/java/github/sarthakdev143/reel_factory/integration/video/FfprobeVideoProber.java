package github.sarthakdev143.reel_factory.integration.video;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.reel_factory.config.RenderProperties;
import github.sarthakdev143.reel_factory.model.VideoProbe;
import github.sarthakdev143.reel_factory.service.VideoProber;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@Component
public class FfprobeVideoProber implements VideoProber {

    private final ProcessRunner processRunner;
    private final RenderProperties properties;
    private final ObjectMapper objectMapper;

    public FfprobeVideoProber(ProcessRunner processRunner, RenderProperties properties, ObjectMapper objectMapper) {
        this.processRunner = processRunner;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public VideoProbe probe(Path videoPath) throws IOException, InterruptedException {
        String output = processRunner.run(buildProbeCommand(videoPath), "probe " + videoPath.getFileName());
        return parseProbeOutput(output, videoPath);
    }

    List<String> buildProbeCommand(Path videoPath) {
        return List.of(
                properties.getFfprobePath(),
                "-v",
                "error",
                "-print_format",
                "json",
                "-show_streams",
                "-show_format",
                videoPath.toString());
    }

    VideoProbe parseProbeOutput(String output, Path videoPath) throws IOException {
        JsonNode root = objectMapper.readTree(output);
        JsonNode videoStream = null;
        boolean hasAudio = false;

        for (JsonNode stream : root.path("streams")) {
            String codecType = stream.path("codec_type").asText();
            if ("video".equals(codecType) && videoStream == null && !isAttachedPicture(stream)) {
                videoStream = stream;
            } else if ("audio".equals(codecType)) {
                hasAudio = true;
            }
        }

        if (videoStream == null) {
            throw new IOException("No video stream found in " + videoPath);
        }

        int width = videoStream.path("width").asInt(0);
        int height = videoStream.path("height").asInt(0);
        if (width <= 0 || height <= 0) {
            throw new IOException("Video stream in " + videoPath + " reports no frame size.");
        }
        if (isQuarterTurn(resolveRotation(videoStream))) {
            int swapped = width;
            width = height;
            height = swapped;
        }

        double duration = parseDouble(root.path("format").path("duration").asText(null));
        if (!(duration > 0)) {
            duration = parseDouble(videoStream.path("duration").asText(null));
        }
        if (!(duration > 0)) {
            throw new IOException("Unable to determine duration of " + videoPath);
        }

        double frameRate = parseFrameRate(videoStream.path("avg_frame_rate").asText(null));
        if (!(frameRate > 0)) {
            frameRate = parseFrameRate(videoStream.path("r_frame_rate").asText(null));
        }

        return new VideoProbe(width, height, duration, frameRate, hasAudio);
    }

    private boolean isAttachedPicture(JsonNode stream) {
        return stream.path("disposition").path("attached_pic").asInt(0) == 1;
    }

    private int resolveRotation(JsonNode videoStream) {
        JsonNode rotateTag = videoStream.path("tags").path("rotate");
        if (!rotateTag.isMissingNode()) {
            return (int) parseDouble(rotateTag.asText());
        }
        for (JsonNode sideData : videoStream.path("side_data_list")) {
            if (sideData.has("rotation")) {
                return sideData.path("rotation").asInt(0);
            }
        }
        return 0;
    }

    private boolean isQuarterTurn(int rotation) {
        int normalized = Math.floorMod(rotation, 360);
        return normalized == 90 || normalized == 270;
    }

    static double parseFrameRate(String value) {
        if (value == null || value.isBlank()) {
            return 0.0;
        }
        int slash = value.indexOf('/');
        if (slash < 0) {
            return parseDouble(value);
        }
        double numerator = parseDouble(value.substring(0, slash));
        double denominator = parseDouble(value.substring(slash + 1));
        if (denominator <= 0) {
            return 0.0;
        }
        return numerator / denominator;
    }

    private static double parseDouble(String value) {
        if (value == null || value.isBlank() || "N/A".equals(value)) {
            return 0.0;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }
}
