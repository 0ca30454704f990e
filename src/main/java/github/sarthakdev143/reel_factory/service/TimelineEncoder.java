package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.composition.CompositionTimeline;

import java.io.IOException;
import java.nio.file.Path;

public interface TimelineEncoder {

    double encode(CompositionTimeline timeline, Path outputPath) throws IOException, InterruptedException;
}
