package com.social.violation.core.model;

/**
 * Definitive result of one publish call.
 *
 * <p>A publish never throws across its public boundary; every path (ack,
 * ambiguous confirm, exhaustion, invalid input) resolves to one of these.</p>
 *
 * @param delivered {@code true} when the broker accepted the message (or the
 *                  confirmation was ambiguous)
 * @param detail    {@code "Success"} on delivery, otherwise the last error message
 * @param messageId the id shared by every attempt of the call
 * @param attempts  number of broker attempts made (0 when input was rejected up front)
 */
public record PublishOutcome(boolean delivered, String detail, String messageId, int attempts) {

    public static final String SUCCESS = "Success";

    public static PublishOutcome success(String messageId, int attempts) {
        return new PublishOutcome(true, SUCCESS, messageId, attempts);
    }

    public static PublishOutcome failure(String messageId, String detail, int attempts) {
        return new PublishOutcome(false, detail, messageId, attempts);
    }
}
