package github.sarthakdev143.reel_factory.integration.text;

import github.sarthakdev143.reel_factory.config.RenderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.Font;
import java.awt.FontFormatException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Picks the caption typeface from a prioritized list of font files. Configured paths win over the
 * built-in list. When nothing can be loaded the JDK logical sans-serif font is used, which always exists.
 */
@Component
public class FontResolver {

    private static final Logger logger = LoggerFactory.getLogger(FontResolver.class);

    static final List<String> DEFAULT_FONT_PATHS = List.of(
            "/usr/share/fonts/truetype/dejavu/DejaVuSans-Bold.ttf",
            "/usr/share/fonts/dejavu/DejaVuSans-Bold.ttf",
            "/usr/share/fonts/TTF/DejaVuSans-Bold.ttf",
            "/usr/share/fonts/truetype/liberation/LiberationSans-Bold.ttf",
            "/usr/share/fonts/liberation-sans/LiberationSans-Bold.ttf",
            "/usr/share/fonts/truetype/noto/NotoSans-Bold.ttf",
            "/Library/Fonts/Arial Bold.ttf",
            "/System/Library/Fonts/Supplemental/Arial Bold.ttf",
            "C:\\Windows\\Fonts\\arialbd.ttf");

    private final List<Path> candidates;
    private volatile Font baseFont;

    public FontResolver(RenderProperties properties) {
        List<Path> paths = new ArrayList<>();
        for (String configured : properties.getFontPaths()) {
            if (configured != null && !configured.isBlank()) {
                paths.add(Path.of(configured.trim()));
            }
        }
        for (String builtIn : DEFAULT_FONT_PATHS) {
            paths.add(Path.of(builtIn));
        }
        this.candidates = List.copyOf(paths);
    }

    public Font resolve(float size) {
        return sized(baseFont(), size);
    }

    // keeps the base style, so the logical fallback stays bold
    static Font sized(Font base, float size) {
        return base.deriveFont(size);
    }

    private Font baseFont() {
        Font font = baseFont;
        if (font == null) {
            synchronized (this) {
                font = baseFont;
                if (font == null) {
                    font = loadFirstAvailable();
                    baseFont = font;
                }
            }
        }
        return font;
    }

    private Font loadFirstAvailable() {
        for (Path candidate : candidates) {
            if (!Files.isRegularFile(candidate)) {
                continue;
            }
            try (InputStream in = Files.newInputStream(candidate)) {
                Font font = Font.createFont(Font.TRUETYPE_FONT, in);
                logger.info("Using caption font {}", candidate);
                return font;
            } catch (IOException | FontFormatException e) {
                logger.warn("Skipping unreadable font {}: {}", candidate, e.getMessage());
            }
        }
        logger.warn("No caption font file found, falling back to the built-in sans-serif font");
        return new Font(Font.SANS_SERIF, Font.BOLD, 12);
    }
}
