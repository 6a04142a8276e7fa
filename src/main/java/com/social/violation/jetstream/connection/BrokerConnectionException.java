package com.social.violation.jetstream.connection;

/**
 * Connection-level failure: no connection, connection closed, socket error,
 * handshake or stream declaration failure.
 *
 * <p>Retryable. The connection manager discards the current channel when it
 * sees this, so the next attempt reconnects.</p>
 */
public class BrokerConnectionException extends RuntimeException {

    public BrokerConnectionException(String message) {
        super(message);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
