package github.sarthakdev143.reel_factory.model;

public record VideoProbe(
        int width,
        int height,
        double durationSeconds,
        double frameRate,
        boolean hasAudio) {

    public static final int DEFAULT_FRAME_RATE = 30;

    public int roundedFrameRate() {
        if (!Double.isFinite(frameRate) || frameRate < 1.0) {
            return DEFAULT_FRAME_RATE;
        }
        return (int) Math.round(frameRate);
    }
}
