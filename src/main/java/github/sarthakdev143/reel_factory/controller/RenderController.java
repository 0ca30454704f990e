package github.sarthakdev143.reel_factory.controller;

import github.sarthakdev143.reel_factory.dto.CaptionVariantRequest;
import github.sarthakdev143.reel_factory.dto.CaptionVariantsRequest;
import github.sarthakdev143.reel_factory.dto.RenderJobSubmissionResponse;
import github.sarthakdev143.reel_factory.model.CanvasSpec;
import github.sarthakdev143.reel_factory.model.CaptionVariant;
import github.sarthakdev143.reel_factory.model.RenderJobState;
import github.sarthakdev143.reel_factory.service.RenderSubmissionService;
import github.sarthakdev143.reel_factory.service.impl.CaptionVariantsFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/render")
public class RenderController {

    private static final Logger logger = LoggerFactory.getLogger(RenderController.class);
    private static final int MAX_LINE_LENGTH = 200;
    private static final int MAX_CREDITS_LENGTH = 200;
    private static final int MAX_VARIANTS = 10;

    private final RenderSubmissionService renderSubmissionService;
    private final CaptionVariantsFormatter captionVariantsFormatter;

    public RenderController(
            RenderSubmissionService renderSubmissionService,
            CaptionVariantsFormatter captionVariantsFormatter) {
        this.renderSubmissionService = renderSubmissionService;
        this.captionVariantsFormatter = captionVariantsFormatter;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<?> submitRender(
            @RequestParam("video") MultipartFile video,
            @RequestParam(value = "lines", required = false) List<String> linesInput,
            @RequestParam(value = "credits", required = false) String credits,
            @RequestParam(value = "width", required = false) Integer width,
            @RequestParam(value = "height", required = false) Integer height) {

        try {
            validateVideo(video);
            List<String> lines = validateLines(linesInput);
            validateCredits(credits);
            CanvasSpec canvas = buildCanvas(width, height);

            String jobId = renderSubmissionService.submitJob(video, lines, credits, canvas);
            return ResponseEntity.accepted()
                    .body(new RenderJobSubmissionResponse(
                            jobId,
                            RenderJobState.QUEUED,
                            "Render job accepted. Poll /api/render/status/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (Exception e) {
            logger.error("Render submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to queue render job. Please try again.");
        }
    }

    @GetMapping("/status/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        return renderSubmissionService.getJobStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    @PostMapping(
            value = "/caption-variants",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> formatCaptionVariants(@RequestBody CaptionVariantsRequest request) {
        List<CaptionVariantRequest> variants = request.variants() == null ? List.of() : request.variants();
        if (variants.size() > MAX_VARIANTS) {
            return ResponseEntity.badRequest().body("Invalid request: at most " + MAX_VARIANTS + " variants are allowed.");
        }

        List<CaptionVariant> mapped = new ArrayList<>();
        for (CaptionVariantRequest variant : variants) {
            if (variant == null || variant.title() == null || variant.title().isBlank()) {
                return ResponseEntity.badRequest().body("Invalid request: every variant needs a title.");
            }
            mapped.add(new CaptionVariant(variant.title(), variant.hashtags()));
        }
        return ResponseEntity.ok(captionVariantsFormatter.format(mapped, request.credits()));
    }

    private void validateVideo(MultipartFile video) {
        if (video == null || video.isEmpty()) {
            throw new IllegalArgumentException("Video file is required.");
        }
        String contentType = video.getContentType();
        if (contentType == null || !contentType.toLowerCase(Locale.ROOT).startsWith("video/")) {
            throw new IllegalArgumentException("video must have a video/* content type.");
        }
    }

    private List<String> validateLines(List<String> linesInput) {
        if (linesInput == null || linesInput.stream().allMatch(line -> line == null || line.isBlank())) {
            throw new IllegalArgumentException("At least one overlay line is required.");
        }
        for (String line : linesInput) {
            if (line != null && line.length() > MAX_LINE_LENGTH) {
                throw new IllegalArgumentException("Each overlay line must be at most " + MAX_LINE_LENGTH + " characters.");
            }
        }
        return linesInput;
    }

    private void validateCredits(String credits) {
        if (credits != null && credits.length() > MAX_CREDITS_LENGTH) {
            throw new IllegalArgumentException("credits must be at most " + MAX_CREDITS_LENGTH + " characters.");
        }
    }

    private CanvasSpec buildCanvas(Integer width, Integer height) {
        if (width == null && height == null) {
            return CanvasSpec.DEFAULT;
        }
        if (width == null || height == null) {
            throw new IllegalArgumentException("width and height must be provided together.");
        }
        return new CanvasSpec(width, height);
    }
}
