package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.model.CanvasSpec;
import github.sarthakdev143.reel_factory.model.FitPlacement;
import github.sarthakdev143.reel_factory.model.RenderJob;
import github.sarthakdev143.reel_factory.model.TextAlignment;
import github.sarthakdev143.reel_factory.model.VideoProbe;
import github.sarthakdev143.reel_factory.model.composition.CompositionTimeline;
import github.sarthakdev143.reel_factory.model.composition.OverlayLayer;
import github.sarthakdev143.reel_factory.model.composition.PanelPlan;
import github.sarthakdev143.reel_factory.service.TextLayoutEngine;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Lays out the caption panel, caption text and credits line over the fitted video and rasterizes the
 * two text layers into the job work directory.
 */
@Component
public class OverlayCompositor {

    static final String BACKGROUND_COLOR = "black";
    static final String PANEL_COLOR = "black";
    static final double PANEL_OPACITY = 0.35;
    static final double PANEL_HEIGHT_RATIO = 0.32;
    static final double PANEL_CENTER_RATIO = 0.60;
    static final double CAPTION_SIDE_MARGIN_RATIO = 0.06;
    static final double CREDITS_INSET_RATIO = 0.02;
    static final double CREDITS_BAND_RATIO = 0.06;
    static final int CAPTION_STROKE = 3;
    static final int CREDITS_STROKE = 2;

    private final TextLayoutEngine textLayoutEngine;

    public OverlayCompositor(TextLayoutEngine textLayoutEngine) {
        this.textLayoutEngine = textLayoutEngine;
    }

    public CompositionTimeline compose(
            Path videoPath,
            VideoProbe probe,
            FitPlacement placement,
            RenderJob job,
            Path workDir) throws IOException {
        CanvasSpec canvas = job.canvas();
        PanelPlan panel = planPanel(canvas);

        int captionMargin = (int) Math.round(canvas.width() * CAPTION_SIDE_MARGIN_RATIO);
        int captionWidth = canvas.width() - 2 * captionMargin;
        BufferedImage captionImage = textLayoutEngine.rasterize(
                job.overlayText(),
                captionWidth,
                panel.height(),
                captionFontSize(canvas),
                TextAlignment.CENTER,
                CAPTION_STROKE);
        OverlayLayer caption = writeLayer(captionImage, workDir.resolve("caption.png"), captionMargin, panel.y());

        int creditsInset = (int) Math.round(canvas.width() * CREDITS_INSET_RATIO);
        int creditsHeight = (int) Math.round(canvas.height() * CREDITS_BAND_RATIO);
        BufferedImage creditsImage = textLayoutEngine.rasterize(
                job.credits(),
                canvas.width() - 2 * creditsInset,
                creditsHeight,
                creditsFontSize(canvas),
                TextAlignment.LEFT,
                CREDITS_STROKE);
        OverlayLayer credits = writeLayer(
                creditsImage,
                workDir.resolve("credits.png"),
                creditsInset,
                canvas.height() - creditsImage.getHeight());

        return new CompositionTimeline(
                videoPath,
                canvas,
                placement,
                BACKGROUND_COLOR,
                panel,
                caption,
                credits,
                probe.durationSeconds(),
                probe.roundedFrameRate(),
                probe.hasAudio());
    }

    PanelPlan planPanel(CanvasSpec canvas) {
        int height = (int) Math.round(canvas.height() * PANEL_HEIGHT_RATIO);
        int centerY = (int) Math.round(canvas.height() * PANEL_CENTER_RATIO);
        int y = Math.max(0, Math.min(canvas.height() - height, centerY - height / 2));
        return new PanelPlan(0, y, canvas.width(), height, PANEL_COLOR, PANEL_OPACITY);
    }

    static float captionFontSize(CanvasSpec canvas) {
        return (float) Math.max(28.0, 0.04 * canvas.height());
    }

    static float creditsFontSize(CanvasSpec canvas) {
        return (float) Math.max(20.0, 0.025 * canvas.height());
    }

    private OverlayLayer writeLayer(BufferedImage image, Path target, int x, int y) throws IOException {
        if (!ImageIO.write(image, "png", target.toFile())) {
            throw new IOException("No PNG writer available for " + target);
        }
        return new OverlayLayer(target, x, y, image.getWidth(), image.getHeight());
    }
}
