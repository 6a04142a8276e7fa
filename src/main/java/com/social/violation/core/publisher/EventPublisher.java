package com.social.violation.core.publisher;

import com.social.violation.core.model.PublishOutcome;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * =====================================================================
 * EventPublisher
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Transport-facing contract for delivering one event to the durable
 * topic exchange. The primary implementation targets NATS JetStream.
 *
 * ROLE IN ARCHITECTURE
 * --------------------
 *
 *   [ Escalation Engine ]
 *          │
 *          ▼
 *   [ EventPublisher ]  ← YOU ARE HERE
 *          │
 *          ▼
 *   [ Broker connection / JetStream ]
 *
 * It knows nothing about violations, users or thresholds.
 *
 * DELIVERY CONTRACT
 * -----------------
 * - A fresh message id is generated once per call and reused by
 *   every retry attempt of that call.
 * - Success means the broker acknowledged the message into the
 *   durable stream (publisher confirm), or the confirmation was
 *   ambiguous (no definitive answer before the confirm timeout).
 * - Connection failures and broker rejections are retried with
 *   exponential backoff against one shared budget.
 * - On exhaustion the event is appended to the local fallback log.
 *
 * FAILURE SEMANTICS
 * -----------------
 * The returned Mono NEVER errors. Every path resolves to a
 * {@link PublishOutcome}.
 *
 * THREAD SAFETY
 * -------------
 * Implementations MUST be safe for concurrent callers. Access to the
 * shared broker channel is serialized internally.
 */
public interface EventPublisher {

    /**
     * Publishes one event.
     *
     * @param routingKey non-blank topic key, e.g. {@code violation.events}
     * @param payload    JSON-serializable map
     * @return Mono emitting the definitive outcome once the retry loop has finished
     */
    Mono<PublishOutcome> publish(String routingKey, Map<String, Object> payload);
}
