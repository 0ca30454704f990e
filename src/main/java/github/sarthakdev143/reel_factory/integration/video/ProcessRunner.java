package github.sarthakdev143.reel_factory.integration.video;

import java.io.IOException;
import java.util.List;

public interface ProcessRunner {

    /**
     * Runs the command to completion and returns its combined output.
     *
     * @throws IOException when the process cannot start, times out or exits with a non-zero code
     */
    String run(List<String> command, String stage) throws IOException, InterruptedException;
}
