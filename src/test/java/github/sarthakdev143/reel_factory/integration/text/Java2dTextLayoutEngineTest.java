package github.sarthakdev143.reel_factory.integration.text;

import github.sarthakdev143.reel_factory.config.RenderProperties;
import github.sarthakdev143.reel_factory.model.TextAlignment;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class Java2dTextLayoutEngineTest {

    private static final float FONT_SIZE = 40f;

    private final Java2dTextLayoutEngine engine = new Java2dTextLayoutEngine(new FontResolver(new RenderProperties()));

    @Test
    void everyWrappedLineFitsTheBoxAndRewrappingIsStable() {
        List<String> texts = List.of(
                "The quick brown fox jumps over the lazy dog while the caption keeps on going and going",
                "Berita viral hari ini: warga menemukan fakta unik tentang sejarah kota mereka sendiri",
                "Short",
                "A\nmulti paragraph\n\ncaption with a deliberately blank line in the middle of it");

        for (int boxWidth : new int[]{180, 320, 640, 950}) {
            for (String text : texts) {
                List<String> lines = engine.wrap(text, FONT_SIZE, boxWidth);

                for (String line : lines) {
                    assertThat(engine.measure(line, FONT_SIZE))
                            .as("line '%s' at width %d", line, boxWidth)
                            .isLessThanOrEqualTo(boxWidth);
                }
                assertThat(engine.wrap(String.join("\n", lines), FONT_SIZE, boxWidth)).isEqualTo(lines);
            }
        }
    }

    @Test
    void preservesHardBreaksAndBlankParagraphs() {
        List<String> lines = engine.wrap("Hello\n\nWorld", FONT_SIZE, 1000);

        assertThat(lines).containsExactly("Hello", "", "World");
    }

    @Test
    void packsWordsGreedilyOntoOneLineWhenTheyFit() {
        List<String> lines = engine.wrap("one two three", FONT_SIZE, 2000);

        assertThat(lines).containsExactly("one two three");
    }

    @Test
    void breaksWordsWiderThanTheBox() {
        String word = "Supercalifragilisticexpialidocious";

        List<String> lines = engine.wrap(word, FONT_SIZE, 120);

        assertThat(lines).hasSizeGreaterThan(1);
        assertThat(String.join("", lines)).isEqualTo(word);
        lines.forEach(line -> assertThat(engine.measure(line, FONT_SIZE)).isLessThanOrEqualTo(120));
    }

    @Test
    void rasterizesToExactBoxSize() {
        BufferedImage image = engine.rasterize("Caption", 950, 614, 76.8f, TextAlignment.CENTER, 3);

        assertThat(image.getWidth()).isEqualTo(950);
        assertThat(image.getHeight()).isEqualTo(614);
        assertThat(image.getColorModel().hasAlpha()).isTrue();
    }

    @Test
    void emptyTextYieldsFullyTransparentImage() {
        BufferedImage image = engine.rasterize("", 1036, 115, 48f, TextAlignment.LEFT, 2);

        assertThat(image.getWidth()).isEqualTo(1036);
        assertThat(image.getHeight()).isEqualTo(115);
        assertThat(countOpaquePixels(image)).isZero();
    }

    @Test
    void degenerateBoxIsClampedInsteadOfFailing() {
        BufferedImage image = engine.rasterize("text", 0, -5, 0f, null, -1);

        assertThat(image.getWidth()).isEqualTo(1);
        assertThat(image.getHeight()).isEqualTo(1);
    }

    @Test
    void drawsWhiteFillWithBlackOutline() {
        BufferedImage image = engine.rasterize("HELLO", 500, 200, 60f, TextAlignment.CENTER, 2);

        boolean hasWhite = false;
        boolean hasBlack = false;
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                int argb = image.getRGB(x, y);
                if (alpha(argb) < 250) {
                    continue;
                }
                int rgb = argb & 0xFFFFFF;
                hasWhite |= rgb == 0xFFFFFF;
                hasBlack |= rgb == 0x000000;
            }
        }
        assertThat(hasWhite).isTrue();
        assertThat(hasBlack).isTrue();
    }

    @Test
    void alignmentMovesTextHorizontally() {
        int width = 800;
        BufferedImage left = engine.rasterize("Credits", width, 100, 40f, TextAlignment.LEFT, 2);
        BufferedImage right = engine.rasterize("Credits", width, 100, 40f, TextAlignment.RIGHT, 2);
        BufferedImage center = engine.rasterize("Credits", width, 100, 40f, TextAlignment.CENTER, 2);

        assertThat(minOpaqueX(left)).isLessThan(15);
        assertThat(maxOpaqueX(right)).isGreaterThan(width - 15);
        int leftGap = minOpaqueX(center);
        int rightGap = width - 1 - maxOpaqueX(center);
        assertThat(Math.abs(leftGap - rightGap)).isLessThan(15);
    }

    @Test
    void edgeAlignedOutlineStaysInsideTheBox() {
        int stroke = 8;
        BufferedImage left = engine.rasterize("Hello", 600, 100, 40f, TextAlignment.LEFT, stroke);
        BufferedImage right = engine.rasterize("Hello", 600, 100, 40f, TextAlignment.RIGHT, stroke);

        assertThat(minX(left, false) - minX(left, true)).isGreaterThanOrEqualTo(stroke - 1);
        assertThat(maxX(right, true) - maxX(right, false)).isGreaterThanOrEqualTo(stroke - 1);
    }

    @Test
    void centersTextBlockVertically() {
        int height = 400;
        BufferedImage image = engine.rasterize("Middle", 600, height, 40f, TextAlignment.CENTER, 0);

        int top = -1;
        int bottom = -1;
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                if (alpha(image.getRGB(x, y)) > 0) {
                    if (top < 0) {
                        top = y;
                    }
                    bottom = y;
                    break;
                }
            }
        }
        assertThat(top).isGreaterThanOrEqualTo(0);
        double inkCenter = (top + bottom) / 2.0;
        assertThat(inkCenter).isBetween(height / 2.0 - 25, height / 2.0 + 25);
    }

    private static boolean isOutline(int argb) {
        return alpha(argb) > 0 && ((argb >> 16) & 0xFF) < 50;
    }

    private static boolean isFill(int argb) {
        return alpha(argb) > 0 && ((argb >> 16) & 0xFF) > 200;
    }

    private static int minX(BufferedImage image, boolean outline) {
        for (int x = 0; x < image.getWidth(); x++) {
            for (int y = 0; y < image.getHeight(); y++) {
                int argb = image.getRGB(x, y);
                if (outline ? isOutline(argb) : isFill(argb)) {
                    return x;
                }
            }
        }
        return -1;
    }

    private static int maxX(BufferedImage image, boolean outline) {
        for (int x = image.getWidth() - 1; x >= 0; x--) {
            for (int y = 0; y < image.getHeight(); y++) {
                int argb = image.getRGB(x, y);
                if (outline ? isOutline(argb) : isFill(argb)) {
                    return x;
                }
            }
        }
        return -1;
    }

    private static int alpha(int argb) {
        return (argb >>> 24) & 0xFF;
    }

    private static int countOpaquePixels(BufferedImage image) {
        int count = 0;
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                if (alpha(image.getRGB(x, y)) > 0) {
                    count++;
                }
            }
        }
        return count;
    }

    private static int minOpaqueX(BufferedImage image) {
        for (int x = 0; x < image.getWidth(); x++) {
            for (int y = 0; y < image.getHeight(); y++) {
                if (alpha(image.getRGB(x, y)) > 0) {
                    return x;
                }
            }
        }
        return -1;
    }

    private static int maxOpaqueX(BufferedImage image) {
        for (int x = image.getWidth() - 1; x >= 0; x--) {
            for (int y = 0; y < image.getHeight(); y++) {
                if (alpha(image.getRGB(x, y)) > 0) {
                    return x;
                }
            }
        }
        return -1;
    }
}
