package github.sarthakdev143.reel_factory.integration.text;

import github.sarthakdev143.reel_factory.model.TextAlignment;
import github.sarthakdev143.reel_factory.service.TextLayoutEngine;
import org.springframework.stereotype.Component;

import java.awt.Color;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Wraps text greedily into a fixed box and paints it white with a black outline on a transparent image.
 */
@Component
public class Java2dTextLayoutEngine implements TextLayoutEngine {

    static final float LINE_HEIGHT_RATIO = 1.25f;
    static final Color FILL_COLOR = Color.WHITE;
    static final Color OUTLINE_COLOR = Color.BLACK;

    private static final int MIN_BOX_SIZE = 1;
    private static final float MIN_FONT_SIZE = 1f;

    private final FontResolver fontResolver;

    public Java2dTextLayoutEngine(FontResolver fontResolver) {
        this.fontResolver = fontResolver;
    }

    @Override
    public List<String> wrap(String text, float fontSize, int boxWidth) {
        BufferedImage scratch = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = scratch.createGraphics();
        try {
            FontMetrics metrics = prepare(graphics, fontSize);
            return wrap(text == null ? "" : text, metrics, Math.max(MIN_BOX_SIZE, boxWidth));
        } finally {
            graphics.dispose();
        }
    }

    public int measure(String line, float fontSize) {
        BufferedImage scratch = new BufferedImage(1, 1, BufferedImage.TYPE_INT_ARGB);
        Graphics2D graphics = scratch.createGraphics();
        try {
            return prepare(graphics, fontSize).stringWidth(line);
        } finally {
            graphics.dispose();
        }
    }

    @Override
    public BufferedImage rasterize(
            String text,
            int boxWidth,
            int boxHeight,
            float fontSize,
            TextAlignment alignment,
            int strokeWidth) {
        int width = Math.max(MIN_BOX_SIZE, boxWidth);
        int height = Math.max(MIN_BOX_SIZE, boxHeight);
        float size = Math.max(MIN_FONT_SIZE, fontSize);
        int stroke = Math.max(0, strokeWidth);
        TextAlignment resolvedAlignment = alignment == null ? TextAlignment.CENTER : alignment;

        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        if (text == null || text.isBlank()) {
            return image;
        }

        Graphics2D graphics = image.createGraphics();
        try {
            FontMetrics metrics = prepare(graphics, size);
            // the outline ring extends stroke pixels past each glyph, keep it inside the box
            int innerWidth = Math.max(MIN_BOX_SIZE, width - 2 * stroke);
            List<String> lines = wrap(text, metrics, innerWidth);

            float lineHeight = LINE_HEIGHT_RATIO * size;
            float top = (height - lineHeight * lines.size()) / 2f;
            float glyphOffset = (lineHeight - (metrics.getAscent() + metrics.getDescent())) / 2f + metrics.getAscent();

            for (int index = 0; index < lines.size(); index++) {
                String line = lines.get(index);
                if (line.isEmpty()) {
                    continue;
                }
                int x = stroke + resolvedAlignment.lineX(innerWidth, metrics.stringWidth(line));
                int y = Math.round(top + index * lineHeight + glyphOffset);
                drawOutlined(graphics, line, x, y, stroke);
            }
        } finally {
            graphics.dispose();
        }
        return image;
    }

    List<String> wrap(String text, FontMetrics metrics, int boxWidth) {
        List<String> lines = new ArrayList<>();
        for (String paragraph : text.split("\\r?\\n", -1)) {
            String trimmed = paragraph.strip();
            if (trimmed.isEmpty()) {
                lines.add("");
                continue;
            }

            String current = "";
            for (String word : trimmed.split("\\s+")) {
                String candidate = current.isEmpty() ? word : current + " " + word;
                if (metrics.stringWidth(candidate) <= boxWidth) {
                    current = candidate;
                    continue;
                }
                if (!current.isEmpty()) {
                    lines.add(current);
                }
                if (metrics.stringWidth(word) <= boxWidth) {
                    current = word;
                } else {
                    List<String> pieces = breakWord(word, metrics, boxWidth);
                    lines.addAll(pieces.subList(0, pieces.size() - 1));
                    current = pieces.get(pieces.size() - 1);
                }
            }
            lines.add(current);
        }
        return lines;
    }

    private List<String> breakWord(String word, FontMetrics metrics, int boxWidth) {
        List<String> pieces = new ArrayList<>();
        StringBuilder piece = new StringBuilder();
        int offset = 0;
        while (offset < word.length()) {
            int codePoint = word.codePointAt(offset);
            String next = piece + new String(Character.toChars(codePoint));
            if (piece.length() > 0 && metrics.stringWidth(next) > boxWidth) {
                pieces.add(piece.toString());
                piece.setLength(0);
            }
            piece.appendCodePoint(codePoint);
            offset += Character.charCount(codePoint);
        }
        pieces.add(piece.toString());
        return pieces;
    }

    private void drawOutlined(Graphics2D graphics, String line, int x, int y, int stroke) {
        graphics.setColor(OUTLINE_COLOR);
        for (int dx = -stroke; dx <= stroke; dx++) {
            for (int dy = -stroke; dy <= stroke; dy++) {
                if (dx == 0 && dy == 0) {
                    continue;
                }
                graphics.drawString(line, x + dx, y + dy);
            }
        }
        graphics.setColor(FILL_COLOR);
        graphics.drawString(line, x, y);
    }

    private FontMetrics prepare(Graphics2D graphics, float fontSize) {
        graphics.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_FRACTIONALMETRICS, RenderingHints.VALUE_FRACTIONALMETRICS_OFF);
        graphics.setFont(fontResolver.resolve(Math.max(MIN_FONT_SIZE, fontSize)));
        return graphics.getFontMetrics();
    }
}
