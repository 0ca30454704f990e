package github.sarthakdev143.reel_factory.model.composition;

import java.nio.file.Path;

public record OverlayLayer(
        Path imagePath,
        int x,
        int y,
        int width,
        int height) {
}
