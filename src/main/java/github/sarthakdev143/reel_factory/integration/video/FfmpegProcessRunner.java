package github.sarthakdev143.reel_factory.integration.video;

import github.sarthakdev143.reel_factory.config.RenderProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
public class FfmpegProcessRunner implements ProcessRunner {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegProcessRunner.class);
    private static final int MAX_OUTPUT_IN_ERROR_CHARS = 4000;

    private final Duration timeout;

    public FfmpegProcessRunner(RenderProperties properties) {
        Duration configuredTimeout = properties.getProcessTimeout();
        this.timeout = configuredTimeout == null ? Duration.ofMinutes(30) : configuredTimeout;
    }

    @Override
    public String run(List<String> command, String stage) throws IOException, InterruptedException {
        logger.info("Running command for stage {}: {}", stage, String.join(" ", command));
        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();

        StringBuilder output = new StringBuilder();
        Thread drainer = new Thread(() -> drain(process, output), "process-output-" + stage.replace(' ', '-'));
        drainer.setDaemon(true);
        drainer.start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("Process timed out after " + timeout + " during stage: " + stage);
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
        drainer.join(TimeUnit.SECONDS.toMillis(5));

        String combinedOutput;
        synchronized (output) {
            combinedOutput = output.toString();
        }
        if (process.exitValue() != 0) {
            throw new IOException(
                    "Process failed during stage "
                            + stage
                            + " with exit code "
                            + process.exitValue()
                            + ". Output: "
                            + tail(combinedOutput));
        }
        return combinedOutput;
    }

    private void drain(Process process, StringBuilder output) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                synchronized (output) {
                    output.append(line).append(System.lineSeparator());
                }
            }
        } catch (IOException e) {
            logger.debug("Stopped reading process output", e);
        }
    }

    private String tail(String output) {
        if (output.length() <= MAX_OUTPUT_IN_ERROR_CHARS) {
            return output;
        }
        return output.substring(output.length() - MAX_OUTPUT_IN_ERROR_CHARS);
    }
}
