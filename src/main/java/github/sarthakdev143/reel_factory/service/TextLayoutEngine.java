package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.TextAlignment;

import java.awt.image.BufferedImage;
import java.util.List;

public interface TextLayoutEngine {

    List<String> wrap(String text, float fontSize, int boxWidth);

    BufferedImage rasterize(
            String text,
            int boxWidth,
            int boxHeight,
            float fontSize,
            TextAlignment alignment,
            int strokeWidth);
}
