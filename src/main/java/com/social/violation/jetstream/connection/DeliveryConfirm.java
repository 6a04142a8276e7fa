package com.social.violation.jetstream.connection;

/**
 * Positive outcome of a single publish attempt.
 *
 * @param stream    stream that stored the message, {@code null} when ambiguous
 * @param sequence  stream sequence, {@code -1} when ambiguous
 * @param duplicate the server recognised the message id as already stored
 * @param ambiguous no definitive ack arrived: timeout, or the connection closed after the message was sent
 */
public record DeliveryConfirm(String stream, long sequence, boolean duplicate, boolean ambiguous) {

    public static DeliveryConfirm acked(String stream, long sequence, boolean duplicate) {
        return new DeliveryConfirm(stream, sequence, duplicate, false);
    }

    public static DeliveryConfirm unconfirmed() {
        return new DeliveryConfirm(null, -1L, false, true);
    }
}
