package github.sarthakdev143.reel_factory.dto;

import java.util.List;

public record CaptionVariantsRequest(
        List<CaptionVariantRequest> variants,
        String credits) {
}
