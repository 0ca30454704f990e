package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.config.RenderProperties;
import github.sarthakdev143.reel_factory.integration.text.FontResolver;
import github.sarthakdev143.reel_factory.integration.text.Java2dTextLayoutEngine;
import github.sarthakdev143.reel_factory.model.CanvasSpec;
import github.sarthakdev143.reel_factory.model.FitPlacement;
import github.sarthakdev143.reel_factory.model.RenderJob;
import github.sarthakdev143.reel_factory.model.TextAlignment;
import github.sarthakdev143.reel_factory.model.VideoProbe;
import github.sarthakdev143.reel_factory.model.composition.CompositionTimeline;
import github.sarthakdev143.reel_factory.model.composition.PanelPlan;
import github.sarthakdev143.reel_factory.service.TextLayoutEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyFloat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OverlayCompositorTest {

    private static final FitPlacement PLACEMENT = new FitPlacement(0.84375, 1080, 607, 0, 656);
    private static final VideoProbe PROBE = new VideoProbe(1280, 720, 12.5, 29.97, true);

    @TempDir
    Path workDir;

    @Test
    void panelIsCenteredAtSixtyPercentWithThirtyTwoPercentHeight() {
        OverlayCompositor compositor = new OverlayCompositor(mock(TextLayoutEngine.class));

        PanelPlan panel = compositor.planPanel(CanvasSpec.DEFAULT);

        assertThat(panel.height()).isEqualTo(614);
        assertThat(panel.y()).isEqualTo(845);
        assertThat(panel.y() + panel.height() / 2.0).isCloseTo(1152.0, offset(1.0));
        assertThat(panel.x()).isZero();
        assertThat(panel.width()).isEqualTo(1080);
        assertThat(panel.opacity()).isEqualTo(0.35);
        assertThat(panel.color()).isEqualTo("black");
    }

    @Test
    void composeRasterizesCaptionAndCreditsWithDerivedFontSizes() throws Exception {
        TextLayoutEngine engine = mock(TextLayoutEngine.class);
        when(engine.rasterize(anyString(), anyInt(), anyInt(), anyFloat(), any(TextAlignment.class), anyInt()))
                .thenAnswer(invocation -> new BufferedImage(
                        invocation.getArgument(1, Integer.class),
                        invocation.getArgument(2, Integer.class),
                        BufferedImage.TYPE_INT_ARGB));
        OverlayCompositor compositor = new OverlayCompositor(engine);
        RenderJob job = new RenderJob("job-1", Path.of("in.mp4"), List.of("One", "Two"), "Source: Wikipedia");

        CompositionTimeline timeline = compositor.compose(Path.of("in.mp4"), PROBE, PLACEMENT, job, workDir);

        verify(engine).rasterize(eq("One\nTwo\n"), eq(950), eq(614), eq(76.8f), eq(TextAlignment.CENTER), eq(3));
        verify(engine).rasterize(eq("Source: Wikipedia"), eq(1036), eq(115), eq(48f), eq(TextAlignment.LEFT), eq(2));

        assertThat(timeline.caption().x()).isEqualTo(65);
        assertThat(timeline.caption().y()).isEqualTo(845);
        assertThat(timeline.credits().x()).isEqualTo(22);
        assertThat(timeline.credits().y()).isEqualTo(1920 - 115);
        assertThat(timeline.caption().imagePath()).exists();
        assertThat(timeline.credits().imagePath()).exists();
        assertThat(timeline.backgroundColor()).isEqualTo("black");
        assertThat(timeline.durationSec()).isEqualTo(12.5);
        assertThat(timeline.frameRate()).isEqualTo(30);
        assertThat(timeline.hasAudio()).isTrue();
        assertThat(timeline.placement()).isEqualTo(PLACEMENT);
    }

    @Test
    void fontSizesHaveFloorsOnSmallCanvases() {
        CanvasSpec small = new CanvasSpec(360, 640);

        assertThat(OverlayCompositor.captionFontSize(small)).isEqualTo(28f);
        assertThat(OverlayCompositor.creditsFontSize(small)).isEqualTo(20f);
        assertThat(OverlayCompositor.captionFontSize(CanvasSpec.DEFAULT)).isEqualTo(76.8f);
        assertThat(OverlayCompositor.creditsFontSize(CanvasSpec.DEFAULT)).isEqualTo(48f);
    }

    @Test
    void emptyCreditsProduceBlankTransparentLayerOfBoxSize() throws Exception {
        OverlayCompositor compositor = new OverlayCompositor(
                new Java2dTextLayoutEngine(new FontResolver(new RenderProperties())));
        RenderJob job = new RenderJob("job-2", Path.of("in.mp4"), List.of("Caption"), "");

        CompositionTimeline timeline = compositor.compose(Path.of("in.mp4"), PROBE, PLACEMENT, job, workDir);

        BufferedImage credits = ImageIO.read(timeline.credits().imagePath().toFile());
        assertThat(credits.getWidth()).isEqualTo(1036);
        assertThat(credits.getHeight()).isEqualTo(115);
        int visiblePixels = 0;
        for (int y = 0; y < credits.getHeight(); y++) {
            for (int x = 0; x < credits.getWidth(); x++) {
                if (((credits.getRGB(x, y) >>> 24) & 0xFF) != 0) {
                    visiblePixels++;
                }
            }
        }
        assertThat(visiblePixels).isZero();

        BufferedImage caption = ImageIO.read(timeline.caption().imagePath().toFile());
        assertThat(caption.getWidth()).isEqualTo(950);
        assertThat(caption.getHeight()).isEqualTo(614);
    }
}
