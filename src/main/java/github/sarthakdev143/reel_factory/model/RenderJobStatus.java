package github.sarthakdev143.reel_factory.model;

import java.time.Instant;

public record RenderJobStatus(
        String jobId,
        RenderJobState state,
        String message,
        Instant createdAt,
        Instant updatedAt,
        String outputPath,
        Double durationSeconds) {

    public RenderJobStatus withState(RenderJobState newState, String newMessage) {
        return new RenderJobStatus(jobId, newState, newMessage, createdAt, Instant.now(), outputPath, durationSeconds);
    }

    public RenderJobStatus completed(RenderResult result, String newMessage) {
        return new RenderJobStatus(
                jobId,
                RenderJobState.COMPLETED,
                newMessage,
                createdAt,
                Instant.now(),
                result.outputPath().toString(),
                result.durationSeconds());
    }
}
