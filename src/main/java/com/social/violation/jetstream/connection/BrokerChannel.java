package com.social.violation.jetstream.connection;

import com.social.violation.core.model.OutboundEvent;

import java.util.List;

/**
 * One open connection/channel pair to the broker, in publisher-confirm mode.
 *
 * <p>Not safe for concurrent use. Callers go through
 * {@link BrokerConnectionManager#withChannel(java.util.function.Function)}.</p>
 */
public interface BrokerChannel extends AutoCloseable {

    boolean isOpen();

    /**
     * Sends one message and waits for the broker's confirmation.
     *
     * @param subject full subject (exchange prefix + routing key)
     * @param event   event whose message id is attached to the message
     * @param body    JSON body
     * @return the confirmation; ambiguous confirmations are returned, not thrown
     * @throws BrokerConnectionException on connection-level failure
     * @throws DeliveryRejectedException when the broker refuses the message
     */
    DeliveryConfirm publish(String subject, OutboundEvent event, byte[] body);

    /**
     * Information about the durable stream behind the exchange, for operators.
     */
    StreamStatus streamStatus();

    @Override
    void close();

    record StreamStatus(String name, List<String> subjects, String storage, long messages, long lastSequence) {
    }
}
