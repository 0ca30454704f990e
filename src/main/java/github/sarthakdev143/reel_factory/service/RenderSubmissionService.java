package github.sarthakdev143.reel_factory.service;

import github.sarthakdev143.reel_factory.model.CanvasSpec;
import github.sarthakdev143.reel_factory.model.RenderJobStatus;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface RenderSubmissionService {

    String submitJob(
            MultipartFile video,
            List<String> overlayLines,
            String credits,
            CanvasSpec canvas) throws IOException;

    Optional<RenderJobStatus> getJobStatus(String jobId);
}
