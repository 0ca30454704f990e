package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.model.CaptionVariant;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Formats the caption-variants text block that accompanies a rendered video:
 * {@code [<index>] <title>\n<hashtags>\n\n} per variant, then an optional credits line.
 */
@Component
public class CaptionVariantsFormatter {

    static final CaptionVariant FALLBACK_VARIANT = new CaptionVariant("Konten Menarik", List.of("#info", "#viral"));

    public String format(List<CaptionVariant> variants, String credits) {
        List<CaptionVariant> effective = variants == null || variants.isEmpty()
                ? List.of(FALLBACK_VARIANT)
                : variants;

        StringBuilder block = new StringBuilder();
        for (int index = 0; index < effective.size(); index++) {
            CaptionVariant variant = effective.get(index);
            block.append('[').append(index + 1).append("] ").append(variant.title()).append('\n');
            block.append(formatHashtags(variant.hashtags())).append("\n\n");
        }

        if (credits != null && !credits.isBlank()) {
            block.append(credits.strip()).append('\n');
        }
        return block.toString();
    }

    private String formatHashtags(List<String> hashtags) {
        return hashtags.stream()
                .filter(tag -> tag != null && !tag.isBlank())
                .map(tag -> tag.strip().replaceAll("\\s+", ""))
                .map(tag -> tag.startsWith("#") ? tag : "#" + tag)
                .collect(Collectors.joining(" "));
    }
}
