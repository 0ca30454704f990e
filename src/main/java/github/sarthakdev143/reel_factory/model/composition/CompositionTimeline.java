package github.sarthakdev143.reel_factory.model.composition;

import github.sarthakdev143.reel_factory.model.CanvasSpec;
import github.sarthakdev143.reel_factory.model.FitPlacement;

import java.nio.file.Path;

/**
 * Layer stack for one render, bottom to top: background, fitted video, panel, caption, credits.
 */
public record CompositionTimeline(
        Path videoPath,
        CanvasSpec canvas,
        FitPlacement placement,
        String backgroundColor,
        PanelPlan panel,
        OverlayLayer caption,
        OverlayLayer credits,
        double durationSec,
        int frameRate,
        boolean hasAudio) {
}
