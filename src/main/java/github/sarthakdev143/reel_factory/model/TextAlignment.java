package github.sarthakdev143.reel_factory.model;

public enum TextAlignment {
    LEFT,
    CENTER,
    RIGHT;

    public int lineX(int boxWidth, int lineWidth) {
        return switch (this) {
            case LEFT -> 0;
            case CENTER -> (boxWidth - lineWidth) / 2;
            case RIGHT -> boxWidth - lineWidth;
        };
    }
}
