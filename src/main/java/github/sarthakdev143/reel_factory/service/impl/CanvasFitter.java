package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.model.CanvasSpec;
import github.sarthakdev143.reel_factory.model.FitPlacement;
import org.springframework.stereotype.Component;

/**
 * Letterbox ("contain") placement of a source frame inside a fixed canvas. The whole source frame
 * always stays visible.
 */
@Component
public class CanvasFitter {

    // absorbs float error so cw/sw * sw never floors to cw - 1
    private static final double EPSILON = 1e-6;

    public FitPlacement fit(int sourceWidth, int sourceHeight, CanvasSpec canvas) {
        return fit(sourceWidth, sourceHeight, canvas.width(), canvas.height());
    }

    public FitPlacement fit(int sourceWidth, int sourceHeight, int canvasWidth, int canvasHeight) {
        if (sourceWidth <= 0 || sourceHeight <= 0) {
            throw new IllegalArgumentException(
                    "Source dimensions must be positive: " + sourceWidth + "x" + sourceHeight);
        }
        if (canvasWidth <= 0 || canvasHeight <= 0) {
            throw new IllegalArgumentException(
                    "Canvas dimensions must be positive: " + canvasWidth + "x" + canvasHeight);
        }

        double scale = Math.min((double) canvasWidth / sourceWidth, (double) canvasHeight / sourceHeight);
        int placedWidth = toPixels(sourceWidth * scale, canvasWidth);
        int placedHeight = toPixels(sourceHeight * scale, canvasHeight);
        int offsetX = (canvasWidth - placedWidth) / 2;
        int offsetY = (canvasHeight - placedHeight) / 2;

        return new FitPlacement(scale, placedWidth, placedHeight, offsetX, offsetY);
    }

    private int toPixels(double value, int limit) {
        int pixels = (int) Math.floor(value + EPSILON);
        return Math.max(1, Math.min(limit, pixels));
    }
}
