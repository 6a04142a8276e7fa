package com.social.violation.api;

import com.social.violation.core.model.EscalationAction;
import com.social.violation.core.model.ModerationRequestContext;
import com.social.violation.core.model.PublishOutcome;
import com.social.violation.core.model.ViolationRecord;
import com.social.violation.core.model.ViolationReport;
import com.social.violation.core.model.ViolationType;
import com.social.violation.escalation.ViolationEscalationEngine;
import com.social.violation.r2dbc.store.ViolationRecordStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ViolationControllerTest {

    private ViolationEscalationEngine engine;
    private ViolationRecordStore store;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        engine = mock(ViolationEscalationEngine.class);
        store = mock(ViolationRecordStore.class);
        client = WebTestClient.bindToController(new ViolationController(engine, store))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void recordedViolationReturnsCreated() {
        when(engine.reportViolation(any(), eq("spam"))).thenReturn(Mono.just(ViolationReport.decided(
                EscalationAction.WARNING, "Warning sent to user u-1", 1, PublishOutcome.success("m-1", 1))));
        byte[] image = {4, 5, 6};

        client.post().uri("/api/moderation/violations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\":\"u-1\",\"description\":\"spam\",\"textContent\":\"buy now\","
                        + "\"imageBase64\":\"" + Base64.getEncoder().encodeToString(image) + "\"}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.recordStatus").isEqualTo("RECORDED")
                .jsonPath("$.action").isEqualTo("WARNING")
                .jsonPath("$.violationCount").isEqualTo(1)
                .jsonPath("$.notification.delivered").isEqualTo(true);

        ArgumentCaptor<ModerationRequestContext> ctx = ArgumentCaptor.forClass(ModerationRequestContext.class);
        verify(engine).reportViolation(ctx.capture(), eq("spam"));
        assertEquals("u-1", ctx.getValue().userId());
        assertEquals("buy now", ctx.getValue().textContent());
        assertArrayEquals(image, ctx.getValue().imageContent());
    }

    @Test
    void failedRecordReturnsServerErrorWithTheReport() {
        when(engine.reportViolation(any(), anyString()))
                .thenReturn(Mono.just(ViolationReport.error("Failed to record violation for user u-1: down")));

        client.post().uri("/api/moderation/violations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\":\"u-1\",\"description\":\"spam\"}")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.recordStatus").isEqualTo("ERROR")
                .jsonPath("$.action").doesNotExist();
    }

    @Test
    void invalidBase64IsABadRequest() {
        client.post().uri("/api/moderation/violations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\":\"u-1\",\"description\":\"spam\",\"imageBase64\":\"***\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("bad_request");

        verifyNoInteractions(engine);
    }

    @Test
    void missingUserIdFailsValidation() {
        client.post().uri("/api/moderation/violations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"description\":\"spam\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("validation_failed");

        verifyNoInteractions(engine);
    }

    @Test
    void listsViolationsWithoutImages() {
        ViolationRecord record = new ViolationRecord(UUID.randomUUID(), "u-1", ViolationType.TEXT, "spam",
                "buy now", null, Instant.parse("2024-06-10T06:13:20Z"));
        when(store.findByUser("u-1", 50)).thenReturn(Flux.just(record));

        client.get().uri("/api/moderation/users/u-1/violations")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].id").isEqualTo(record.id().toString())
                .jsonPath("$[0].violationType").isEqualTo("TEXT")
                .jsonPath("$[0].imageContent").doesNotExist();
    }

    @Test
    void countsViolations() {
        when(store.countByUser("u-1")).thenReturn(Mono.just(4L));

        client.get().uri("/api/moderation/users/u-1/violations/count")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.userId").isEqualTo("u-1")
                .jsonPath("$.violationCount").isEqualTo(4);
    }
}
