package github.sarthakdev143.reel_factory.service.impl;

import github.sarthakdev143.reel_factory.config.RenderProperties;
import github.sarthakdev143.reel_factory.model.CanvasSpec;
import github.sarthakdev143.reel_factory.model.RenderJob;
import github.sarthakdev143.reel_factory.model.RenderJobState;
import github.sarthakdev143.reel_factory.model.RenderJobStatus;
import github.sarthakdev143.reel_factory.model.RenderResult;
import github.sarthakdev143.reel_factory.service.RenderOutcomeListener;
import github.sarthakdev143.reel_factory.service.RenderQueue;
import github.sarthakdev143.reel_factory.service.RenderSubmissionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Accepts uploaded videos, hands them to the render queue and tracks each job until its outcome has
 * been collected once.
 */
@Service
public class DefaultRenderSubmissionService implements RenderSubmissionService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultRenderSubmissionService.class);

    private final RenderQueue renderQueue;
    private final Duration statusRetention;
    private final Map<String, RenderJobStatus> jobs = new ConcurrentHashMap<>();

    public DefaultRenderSubmissionService(RenderQueue renderQueue, RenderProperties properties) {
        this.renderQueue = renderQueue;
        Duration configuredRetention = properties.getStatusRetention();
        this.statusRetention = configuredRetention == null ? Duration.ofHours(1) : configuredRetention;
    }

    @Override
    public String submitJob(
            MultipartFile video,
            List<String> overlayLines,
            String credits,
            CanvasSpec canvas) throws IOException {
        evictExpiredStatuses();
        String jobId = UUID.randomUUID().toString();
        Path sourcePath = Files.createTempFile("reel-factory-source-", resolveVideoSuffix(video.getOriginalFilename()));
        try {
            video.transferTo(sourcePath);
        } catch (IOException e) {
            deleteTempFile(sourcePath);
            throw e;
        }

        RenderJob job = new RenderJob(jobId, sourcePath, overlayLines, credits, canvas);
        Instant now = Instant.now();
        jobs.put(jobId, new RenderJobStatus(jobId, RenderJobState.QUEUED, "Job queued.", now, now, null, null));

        logger.info(
                "Accepted render job {} lines={} canvas={}x{} hasCredits={}",
                jobId,
                job.overlayLines().size(),
                job.canvas().width(),
                job.canvas().height(),
                !job.credits().isEmpty());

        try {
            renderQueue.submit(job, new StatusTrackingListener(sourcePath));
        } catch (RuntimeException e) {
            jobs.remove(jobId);
            deleteTempFile(sourcePath);
            throw e;
        }
        return jobId;
    }

    @Override
    public Optional<RenderJobStatus> getJobStatus(String jobId) {
        evictExpiredStatuses();
        RenderJobStatus status = jobs.get(jobId);
        if (status != null && status.state().isTerminal()) {
            // outcomes are handed over once, no history is kept
            jobs.remove(jobId, status);
        }
        return Optional.ofNullable(status);
    }

    int trackedJobCount() {
        return jobs.size();
    }

    // terminal statuses nobody collected are dropped once the retention window has passed
    private void evictExpiredStatuses() {
        Instant cutoff = Instant.now().minus(statusRetention);
        jobs.values().removeIf(status -> status.state().isTerminal() && !status.updatedAt().isAfter(cutoff));
    }

    private void updateJob(String jobId, RenderJobState state, String message) {
        jobs.computeIfPresent(jobId, (ignored, current) -> current.withState(state, message));
    }

    private String resolveVideoSuffix(String originalFilename) {
        if (originalFilename != null) {
            int dot = originalFilename.lastIndexOf('.');
            if (dot >= 0 && dot < originalFilename.length() - 1) {
                String extension = originalFilename.substring(dot).toLowerCase(Locale.ROOT);
                if (extension.matches("\\.[a-z0-9]{1,5}")) {
                    return extension;
                }
            }
        }
        return ".mp4";
    }

    private void deleteTempFile(Path filePath) {
        if (filePath == null) {
            return;
        }
        try {
            Files.deleteIfExists(filePath);
        } catch (IOException e) {
            logger.warn("Could not delete temp file {}", filePath, e);
        }
    }

    private final class StatusTrackingListener implements RenderOutcomeListener {

        private final Path uploadedSource;

        private StatusTrackingListener(Path uploadedSource) {
            this.uploadedSource = uploadedSource;
        }

        @Override
        public void onStarted(String jobId) {
            updateJob(jobId, RenderJobState.PROCESSING, "Rendering video.");
        }

        @Override
        public void onCompleted(String jobId, RenderResult result) {
            jobs.computeIfPresent(jobId, (ignored, current) -> current.completed(result, "Video rendered successfully."));
            deleteTempFile(uploadedSource);
        }

        @Override
        public void onFailed(String jobId, Throwable cause) {
            updateJob(jobId, RenderJobState.FAILED, "Render failed. Check server logs.");
            deleteTempFile(uploadedSource);
        }
    }
}
