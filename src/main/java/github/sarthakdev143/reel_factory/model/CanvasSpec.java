package github.sarthakdev143.reel_factory.model;

public record CanvasSpec(int width, int height) {

    public static final int MAX_DIMENSION = 4096;
    public static final CanvasSpec DEFAULT = new CanvasSpec(1080, 1920);

    public CanvasSpec {
        requireDimension("width", width);
        requireDimension("height", height);
    }

    public boolean isPortrait() {
        return height >= width;
    }

    private static void requireDimension(String name, int value) {
        if (value <= 0 || value > MAX_DIMENSION) {
            throw new IllegalArgumentException(
                    "Canvas " + name + " must be between 1 and " + MAX_DIMENSION + " pixels.");
        }
        // libx264 rejects odd frame sizes for 4:2:0 output
        if (value % 2 != 0) {
            throw new IllegalArgumentException("Canvas " + name + " must be an even number of pixels.");
        }
    }
}
