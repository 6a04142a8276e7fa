package com.social.violation.jetstream.connection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * =====================================================================
 * BrokerConnectionManager
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Owns the process-wide broker connection. At most one channel is open
 * at any time and every use of it is serialized through one lock.
 *
 * Constructed by the composition root ({@code BrokerConfig}) and injected
 * into the publisher, so tests can hand it a fake channel factory.
 *
 * CRITICAL SECTION
 * ----------------
 * {@link #withChannel(Function)} holds the lock for:
 *  1. the open-check,
 *  2. a reconnect when the channel is missing or closed,
 *  3. the caller's action (one publish attempt).
 *
 * A thread that finds the channel closed reconnects while holding the
 * lock, so two threads can never connect at the same time. Callers must
 * not sleep (backoff) inside the action.
 *
 * FAILURE HANDLING
 * ----------------
 * - Connect failure: state returns to DISCONNECTED, the exception propagates.
 * - {@link BrokerConnectionException} from the action: the channel is closed
 *   and dropped; the next call reconnects.
 * - Any other exception from the action leaves the channel in place.
 */
public class BrokerConnectionManager implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(BrokerConnectionManager.class);

    private final BrokerChannelFactory factory;
    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong connects = new AtomicLong();

    /** Guarded by {@link #lock}. */
    private BrokerChannel channel;

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    public BrokerConnectionManager(BrokerChannelFactory factory) {
        this.factory = factory;
    }

    /**
     * Runs an action against the open channel, connecting first if needed.
     *
     * @throws BrokerConnectionException when no channel could be opened or the action lost the connection
     */
    public <T> T withChannel(Function<BrokerChannel, T> action) {
        lock.lock();
        try {
            BrokerChannel ch = ensureOpen();
            try {
                return action.apply(ch);
            } catch (BrokerConnectionException e) {
                log.warn("Broker connection failed during use: {}", e.getMessage());
                discard();
                throw e;
            }
        } finally {
            lock.unlock();
        }
    }

    private BrokerChannel ensureOpen() {
        if (channel != null) {
            if (channel.isOpen()) {
                return channel;
            }
            log.info("Broker connection found closed. Reconnecting...");
            discard();
        }

        state = ConnectionState.CONNECTING;
        try {
            channel = factory.open();
        } catch (BrokerConnectionException e) {
            state = ConnectionState.DISCONNECTED;
            log.error("Failed to connect to broker: {}", e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            state = ConnectionState.DISCONNECTED;
            log.error("Failed to connect to broker: {}", e.getMessage());
            throw new BrokerConnectionException("Could not establish connection to broker: " + e.getMessage(), e);
        }
        state = ConnectionState.CONNECTED;
        long n = connects.incrementAndGet();
        log.info("Broker channel ready (connect #{})", n);
        return channel;
    }

    private void discard() {
        BrokerChannel ch = channel;
        channel = null;
        state = ConnectionState.DISCONNECTED;
        if (ch != null) {
            try {
                ch.close();
            } catch (RuntimeException e) {
                log.debug("Ignoring failure while closing broker channel: {}", e.getMessage());
            }
        }
    }

    /**
     * Tears the channel down. A later {@link #withChannel(Function)} reconnects.
     */
    public void close() {
        lock.lock();
        try {
            if (channel != null) {
                discard();
                log.info("Broker connection closed.");
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void destroy() {
        close();
    }

    public ConnectionState state() {
        return state;
    }

    /** Number of successful connects over the life of this manager. */
    public long connectCount() {
        return connects.get();
    }
}
