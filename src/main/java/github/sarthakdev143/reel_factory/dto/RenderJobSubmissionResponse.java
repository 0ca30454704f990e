package github.sarthakdev143.reel_factory.dto;

import github.sarthakdev143.reel_factory.model.RenderJobState;

public record RenderJobSubmissionResponse(
        String jobId,
        RenderJobState state,
        String message) {
}
