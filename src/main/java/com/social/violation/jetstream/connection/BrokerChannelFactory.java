package com.social.violation.jetstream.connection;

/**
 * Opens a fresh channel: connects, enables confirms and declares the exchange.
 *
 * <p>First use and recovery share this single path.</p>
 */
@FunctionalInterface
public interface BrokerChannelFactory {

    /**
     * @throws BrokerConnectionException when the broker cannot be reached or the
     *                                   exchange cannot be declared
     */
    BrokerChannel open();
}
