package com.phillippitts.affectsignal.presentation.controller;

import com.phillippitts.affectsignal.domain.CaptureKey;
import com.phillippitts.affectsignal.domain.ImageArtifact;
import com.phillippitts.affectsignal.domain.QuestionExpression;
import com.phillippitts.affectsignal.exception.UnknownSessionException;
import com.phillippitts.affectsignal.service.aggregate.SessionReport;
import com.phillippitts.affectsignal.service.pipeline.AffectPipeline;
import com.phillippitts.affectsignal.service.pipeline.CaptureTrigger;
import com.phillippitts.affectsignal.service.pipeline.SessionRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * HTTP surface of the capture pipeline.
 *
 * <p>A capture opens its session on first use. Captures are accepted immediately (202) and
 * resolved in the background; clients read the outcome through the expression and report
 * endpoints.
 */
@RestController
@RequestMapping("/api/sessions/{sessionId}")
public class CaptureController {

    private static final Logger LOG = LogManager.getLogger(CaptureController.class);

    private final SessionRegistry sessions;

    public CaptureController(SessionRegistry sessions) {
        this.sessions = sessions;
    }

    @PostMapping(path = "/captures", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<CaptureResponse> capture(@PathVariable String sessionId,
                                                   @RequestParam("image") MultipartFile image,
                                                   @RequestParam String roundId,
                                                   @RequestParam String questionId,
                                                   @RequestParam int ordinal) throws IOException {
        CaptureKey key = new CaptureKey(roundId, questionId, ordinal);
        String mimeType = image.getContentType() != null ? image.getContentType() : MediaType.IMAGE_JPEG_VALUE;
        ImageArtifact artifact = new ImageArtifact(image.getBytes(), mimeType, image.getOriginalFilename());

        AffectPipeline pipeline = sessions.open(sessionId);
        CaptureTrigger trigger = pipeline.trigger(key, artifact);
        LOG.debug("Capture {} for question {} ({} bytes)",
                trigger.duplicate() ? "duplicate" : "accepted", questionId, artifact.size());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new CaptureResponse(questionId, trigger.duplicate() ? "duplicate" : "accepted"));
    }

    @GetMapping("/expressions/{questionId}")
    public ResponseEntity<QuestionExpression> expression(@PathVariable String sessionId,
                                                         @PathVariable String questionId) {
        return sessions.get(sessionId).expression(questionId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/report")
    public SessionReport report(@PathVariable String sessionId) {
        return sessions.get(sessionId).report();
    }

    @DeleteMapping
    public ResponseEntity<Void> close(@PathVariable String sessionId) {
        if (!sessions.close(sessionId)) {
            throw new UnknownSessionException(sessionId);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * @param questionId question the capture was for
     * @param status {@code accepted} or {@code duplicate}
     */
    public record CaptureResponse(String questionId, String status) {
    }
}
