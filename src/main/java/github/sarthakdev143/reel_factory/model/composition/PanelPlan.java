package github.sarthakdev143.reel_factory.model.composition;

public record PanelPlan(
        int x,
        int y,
        int width,
        int height,
        String color,
        double opacity) {
}
