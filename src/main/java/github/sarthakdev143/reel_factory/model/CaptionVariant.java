package github.sarthakdev143.reel_factory.model;

import java.util.List;
import java.util.Objects;

public record CaptionVariant(String title, List<String> hashtags) {

    public CaptionVariant {
        title = title == null ? "" : title.strip();
        hashtags = hashtags == null ? List.of() : hashtags.stream().filter(Objects::nonNull).toList();
    }
}
