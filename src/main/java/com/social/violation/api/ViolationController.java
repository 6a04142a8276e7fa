package com.social.violation.api;

import com.social.violation.core.model.ModerationRequestContext;
import com.social.violation.core.model.ViolationRecord;
import com.social.violation.core.model.ViolationReport;
import com.social.violation.escalation.ViolationEscalationEngine;
import com.social.violation.r2dbc.store.ViolationRecordStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Base64;
import java.util.Map;
import java.util.UUID;

/**
 * Moderation entry point: reports a violation and exposes the per-user audit trail.
 *
 * The request body is turned into a {@link ModerationRequestContext} here, once, and
 * passed to the engine together with the description.
 */
@RestController
@Validated
@RequestMapping(path = "/api/moderation", produces = MediaType.APPLICATION_JSON_VALUE)
public class ViolationController {

    private static final int DEFAULT_LIMIT = 50;

    private final ViolationEscalationEngine engine;
    private final ViolationRecordStore store;

    public ViolationController(ViolationEscalationEngine engine, ViolationRecordStore store) {
        this.engine = engine;
        this.store = store;
    }

    /**
     * 201 when the violation was recorded (whatever the notification outcome),
     * 500 with the report when it was not.
     */
    @PostMapping(path = "/violations", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ViolationReport>> report(@Valid @RequestBody ViolationReportRequest req) {
        ModerationRequestContext ctx = new ModerationRequestContext(req.userId(), req.textContent(),
                decodeImage(req.imageBase64()));

        return engine.reportViolation(ctx, req.description())
                .map(report -> ResponseEntity
                        .status(report.isRecorded() ? HttpStatus.CREATED : HttpStatus.INTERNAL_SERVER_ERROR)
                        .body(report));
    }

    @GetMapping("/users/{userId}/violations")
    public Flux<ViolationView> list(@PathVariable String userId,
                                    @RequestParam(defaultValue = "" + DEFAULT_LIMIT) @Min(1) @Max(500) int limit) {
        return store.findByUser(userId, limit).map(ViolationView::of);
    }

    @GetMapping("/users/{userId}/violations/count")
    public Mono<Map<String, Object>> count(@PathVariable String userId) {
        return store.countByUser(userId)
                .map(count -> Map.<String, Object>of("userId", userId, "violationCount", count));
    }

    private static byte[] decodeImage(String imageBase64) {
        if (imageBase64 == null || imageBase64.isBlank()) {
            return null;
        }
        try {
            return Base64.getDecoder().decode(imageBase64.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("imageBase64 is not valid base64", e);
        }
    }

    public record ViolationView(UUID id, String userId, String violationType, String description,
                                String textContent, Instant createdAt) {

        static ViolationView of(ViolationRecord r) {
            return new ViolationView(r.id(), r.userId(), r.violationType().name(), r.description(),
                    r.textContent(), r.createdAt());
        }
    }
}
