package com.social.violation.core.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * =====================================================================
 * OutboundEvent
 * =====================================================================
 *
 * PURPOSE ------- One logical event handed to the broker. Built exactly once
 * per publish call; every retry attempt of that call sends this same object.
 *
 * IDENTITY -------- {@link #messageId} is assigned by the publisher, never by
 * the caller. It is reused across all attempts of one call and becomes the
 * JetStream {@code Nats-Msg-Id}, so the server (and downstream consumers) can
 * drop duplicates produced by retries.
 *
 * LIFECYCLE --------- Acknowledged by the broker, rejected, or exhausted after
 * retries. On exhaustion it is written once to the fallback log and then
 * dropped; the publisher keeps no other copy.
 */
public record OutboundEvent(

		/** Fresh per publish call, stable across its retries. */
		String messageId,

		/**
		 * Topic key selecting downstream consumers (e.g. {@code violation.events}).
		 * Appended to the exchange prefix to form the JetStream subject.
		 */
		String routingKey,

		/** JSON-serializable body: event type, user id, title/body templates. */
		Map<String, Object> payload,

		/** When the publisher accepted the event. Used by the fallback log. */
		Instant createdAt) {

	public OutboundEvent {
		Objects.requireNonNull(messageId, "messageId");
		payload = payload == null ? Map.of() : payload;
	}

	/**
	 * Creates an event with a new random message id.
	 */
	public static OutboundEvent create(String routingKey, Map<String, Object> payload, Instant now) {
		return new OutboundEvent(UUID.randomUUID().toString(), routingKey, payload, now);
	}
}
