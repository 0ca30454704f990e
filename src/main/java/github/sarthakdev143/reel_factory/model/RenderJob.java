package github.sarthakdev143.reel_factory.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A single render request: one background video, the overlay script and the credits line.
 * Overlay lines are normalized on construction so that every job carries between
 * {@value #MIN_OVERLAY_LINES} and {@value #MAX_OVERLAY_LINES} lines.
 */
public record RenderJob(
        String jobId,
        Path sourceVideo,
        List<String> overlayLines,
        String credits,
        CanvasSpec canvas) {

    public static final int MIN_OVERLAY_LINES = 3;
    public static final int MAX_OVERLAY_LINES = 6;

    public RenderJob {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId is required.");
        }
        if (sourceVideo == null) {
            throw new IllegalArgumentException("sourceVideo is required.");
        }
        overlayLines = normalizeOverlayLines(overlayLines);
        credits = credits == null ? "" : credits.strip();
        canvas = canvas == null ? CanvasSpec.DEFAULT : canvas;
    }

    public RenderJob(String jobId, Path sourceVideo, List<String> overlayLines, String credits) {
        this(jobId, sourceVideo, overlayLines, credits, CanvasSpec.DEFAULT);
    }

    public String overlayText() {
        return String.join("\n", overlayLines);
    }

    static List<String> normalizeOverlayLines(List<String> lines) {
        List<String> normalized = new ArrayList<>(MAX_OVERLAY_LINES);
        if (lines != null) {
            for (String line : lines) {
                if (normalized.size() == MAX_OVERLAY_LINES) {
                    break;
                }
                normalized.add(line == null ? "" : line.strip());
            }
        }
        while (normalized.size() < MIN_OVERLAY_LINES) {
            normalized.add("");
        }
        return List.copyOf(normalized);
    }
}
