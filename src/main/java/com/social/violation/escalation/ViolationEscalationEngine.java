package com.social.violation.escalation;

import com.social.violation.core.escalation.EscalationPolicy;
import com.social.violation.core.escalation.NotificationTemplates;
import com.social.violation.core.model.EscalationAction;
import com.social.violation.core.model.ModerationRequestContext;
import com.social.violation.core.model.PublishOutcome;
import com.social.violation.core.model.ViolationRecord;
import com.social.violation.core.model.ViolationReport;
import com.social.violation.core.publisher.EventPublisher;
import com.social.violation.r2dbc.store.ViolationRecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * =====================================================================
 * ViolationEscalationEngine
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Turns one reported violation into one durable record and one
 * user-facing action (warning or ban), then notifies the user through
 * the {@link EventPublisher}.
 *
 * FLOW
 * ----
 *  1. Validate: userId and description must be present.
 *  2. Persist the {@link ViolationRecord}.
 *  3. Re-read the user's all-time count (never cached).
 *  4. Decide with {@link EscalationPolicy} ({@code count >= threshold} bans).
 *  5. Publish the notification on {@code violation.events}.
 *
 * FAILURE SEMANTICS
 * -----------------
 * - Insert or count failure: {@code ERROR} report, no decision, no publish.
 *   A failed count is never read as zero.
 * - Notification failure: the decision stands; the failed
 *   {@link PublishOutcome} is returned in the report.
 * - The returned Mono never errors.
 *
 * CONCURRENCY
 * -----------
 * Reports for the same user are not serialized. Two in-flight reports
 * may both read the same count, which can delay a ban by one violation
 * but never bring it forward.
 */
@Service
public class ViolationEscalationEngine {

    private static final Logger log = LoggerFactory.getLogger(ViolationEscalationEngine.class);

    private final ViolationRecordStore store;
    private final EventPublisher publisher;
    private final EscalationPolicy policy;

    public ViolationEscalationEngine(ViolationRecordStore store, EventPublisher publisher, EscalationPolicy policy) {
        this.store = store;
        this.publisher = publisher;
        this.policy = policy;
    }

    /**
     * Records a violation against the user carried by {@code ctx}.
     *
     * @param ctx         request-scoped content of the moderated request
     * @param description why the content was flagged
     */
    public Mono<ViolationReport> reportViolation(ModerationRequestContext ctx, String description) {
        return Mono.defer(() -> {
            if (ctx == null || isBlank(ctx.userId())) {
                log.warn("Violation report rejected: missing userId in request context");
                return Mono.just(ViolationReport.error("userId is required"));
            }
            if (isBlank(description)) {
                log.warn("Violation report rejected for user={}: missing description", ctx.userId());
                return Mono.just(ViolationReport.error("description is required"));
            }

            String userId = ctx.userId();
            ViolationRecord draft = ViolationRecord.draft(userId, description, ctx.textContent(), ctx.imageContent());

            return recordAndCount(draft)
                    .flatMap(count -> escalate(userId, description, count))
                    .onErrorResume(RecordingFailedException.class,
                            e -> Mono.just(ViolationReport.error(e.getMessage())))
                    .onErrorResume(e -> {
                        log.error("Violation report failed for user={}", userId, e);
                        return Mono.just(ViolationReport.error("Violation report failed: " + e.getMessage()));
                    });
        });
    }

    private Mono<Long> recordAndCount(ViolationRecord draft) {
        String userId = draft.userId();
        return Mono.defer(() -> store.insert(draft))
                .onErrorMap(e -> failed("Failed to record violation for user " + userId, e))
                .doOnNext(saved -> log.info("Recorded violation id={} user={} type={}",
                        saved.id(), userId, saved.violationType()))
                .flatMap(saved -> Mono.defer(() -> store.countByUser(userId))
                        .onErrorMap(e -> failed("Failed to count violations for user " + userId, e)))
                .switchIfEmpty(Mono.error(() -> new RecordingFailedException(
                        "No violation count returned for user " + userId, null)));
    }

    private Mono<ViolationReport> escalate(String userId, String description, long count) {
        EscalationAction action = policy.decide(count);
        String detail = NotificationTemplates.detail(action, userId);

        if (action == EscalationAction.BAN) {
            log.warn("Banning user={} count={} threshold={}", userId, count, policy.banThreshold());
        } else {
            log.info("Warning user={} count={} threshold={}", userId, count, policy.banThreshold());
        }

        return Mono.defer(() -> publisher.publish(NotificationTemplates.ROUTING_KEY,
                        NotificationTemplates.payload(action, userId, description, count)))
                .onErrorResume(e -> Mono.just(PublishOutcome.failure(null, e.getMessage(), 0)))
                .defaultIfEmpty(PublishOutcome.failure(null, "Publisher returned no outcome", 0))
                .doOnNext(outcome -> {
                    if (!outcome.delivered()) {
                        log.warn("Notification for user={} action={} not delivered: {}",
                                userId, action, outcome.detail());
                    }
                })
                .map(outcome -> ViolationReport.decided(action, detail, count, outcome));
    }

    private static RecordingFailedException failed(String message, Throwable cause) {
        if (cause instanceof RecordingFailedException r) {
            return r;
        }
        log.error("{}: {}", message, cause.toString());
        return new RecordingFailedException(message + ": " + cause.getMessage(), cause);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /** Persistence or count failure; never escapes {@link #reportViolation}. */
    static final class RecordingFailedException extends RuntimeException {
        RecordingFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
