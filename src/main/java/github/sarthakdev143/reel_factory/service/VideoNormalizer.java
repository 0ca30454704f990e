package github.sarthakdev143.reel_factory.service;

import java.nio.file.Path;

public interface VideoNormalizer {

    /**
     * Returns a re-encoded copy of the source, or the source itself when re-encoding is not possible.
     */
    Path normalize(Path sourcePath) throws InterruptedException;
}
