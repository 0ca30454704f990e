package github.sarthakdev143.reel_factory.model;

public record FitPlacement(
        double scale,
        int placedWidth,
        int placedHeight,
        int offsetX,
        int offsetY) {
}
