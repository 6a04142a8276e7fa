package com.social.violation.jetstream.connection;

/**
 * The broker answered and refused this specific message (API error, no stream
 * bound to the subject, expected-stream mismatch).
 *
 * <p>Retryable against the same budget as connection failures, but the
 * connection itself is kept.</p>
 */
public class DeliveryRejectedException extends RuntimeException {

    public DeliveryRejectedException(String message) {
        super(message);
    }

    public DeliveryRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
