package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.VideoProbe;

import java.io.IOException;
import java.nio.file.Path;

public interface VideoProber {

    VideoProbe probe(Path videoPath) throws IOException, InterruptedException;
}
