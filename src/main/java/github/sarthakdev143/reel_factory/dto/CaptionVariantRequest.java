package github.sarthakdev143.reel_factory.dto;

import java.util.List;

public record CaptionVariantRequest(
        String title,
        List<String> hashtags) {
}
