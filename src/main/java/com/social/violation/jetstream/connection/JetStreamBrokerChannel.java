package com.social.violation.jetstream.connection;

import com.social.violation.core.model.OutboundEvent;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.PublishOptions;
import io.nats.client.api.PublishAck;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import io.nats.client.api.StreamState;
import io.nats.client.impl.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * JetStream-backed {@link BrokerChannel}.
 *
 * <h2>Publish semantics</h2>
 * <ul>
 *   <li>{@code Nats-Msg-Id} is set from {@link OutboundEvent#messageId()}, so a retried attempt of the
 *       same call is stored once (JetStream de-duplication window).</li>
 *   <li>{@code expectedStream} plays the role of the {@code mandatory} flag: if no stream (or another
 *       stream) captures the subject, the server refuses the message.</li>
 *   <li>Every publish waits for the {@link PublishAck} (publisher confirm) up to the confirm timeout.</li>
 * </ul>
 *
 * <h2>Failure classification</h2>
 * <ul>
 *   <li>Client refuses to send (connection closed or draining): {@link BrokerConnectionException}.
 *       Nothing left the process, so the attempt is safe to repeat after a reconnect.</li>
 *   <li>Server answered with an API error or a status response: {@link DeliveryRejectedException}.</li>
 *   <li>The message was sent but no definitive answer came back (timeout, interrupted wait,
 *       pending ack cancelled, connection closed before the ack): ambiguous confirm.</li>
 * </ul>
 */
final class JetStreamBrokerChannel implements BrokerChannel {

    private static final Logger log = LoggerFactory.getLogger(JetStreamBrokerChannel.class);

    static final String CONTENT_TYPE_HEADER = "Content-Type";
    static final String MESSAGE_ID_HEADER = "Message-Id";
    static final String JSON = "application/json";

    private final Connection connection;
    private final JetStream js;
    private final JetStreamManagement jsm;
    private final String streamName;
    private final Duration confirmTimeout;

    JetStreamBrokerChannel(Connection connection, JetStream js, JetStreamManagement jsm,
                           String streamName, Duration confirmTimeout) {
        this.connection = connection;
        this.js = js;
        this.jsm = jsm;
        this.streamName = streamName;
        this.confirmTimeout = confirmTimeout;
    }

    @Override
    public boolean isOpen() {
        return connection.getStatus() == Connection.Status.CONNECTED;
    }

    @Override
    public DeliveryConfirm publish(String subject, OutboundEvent event, byte[] body) {
        Headers headers = new Headers()
                .add(CONTENT_TYPE_HEADER, JSON)
                .add(MESSAGE_ID_HEADER, event.messageId());

        PublishOptions opts = PublishOptions.builder()
                .messageId(event.messageId())
                .expectedStream(streamName)
                .build();

        CompletableFuture<PublishAck> pending;
        try {
            pending = js.publishAsync(subject, headers, body, opts);
        } catch (IllegalStateException e) {
            // jnats refuses to write on a closed or draining connection
            throw new BrokerConnectionException("Connection closed: " + e.getMessage(), e);
        }

        try {
            PublishAck ack = pending.get(confirmTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return DeliveryConfirm.acked(ack.getStream(), ack.getSeqno(), ack.isDuplicate());
        } catch (TimeoutException e) {
            log.warn("No publish ack within {} msgId={} subject={} (ambiguous confirm)",
                    confirmTimeout, event.messageId(), subject);
            return DeliveryConfirm.unconfirmed();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for publish ack msgId={} (ambiguous confirm)", event.messageId());
            return DeliveryConfirm.unconfirmed();
        } catch (CancellationException e) {
            log.warn("Pending publish ack cancelled msgId={} subject={} (ambiguous confirm)",
                    event.messageId(), subject);
            return DeliveryConfirm.unconfirmed();
        } catch (ExecutionException e) {
            return classifyAfterSend(unwrap(e.getCause()), event, subject);
        }
    }

    /**
     * The message has left the client; only a server answer can make this a rejection.
     */
    private DeliveryConfirm classifyAfterSend(Throwable cause, OutboundEvent event, String subject) {
        if (cause instanceof JetStreamApiException api) {
            throw new DeliveryRejectedException("Broker rejected msgId=" + event.messageId()
                    + " apiErrorCode=" + api.getApiErrorCode() + ": " + api.getErrorDescription(), api);
        }
        if (!isOpen() || cause instanceof CancellationException) {
            log.warn("Connection closed before publish ack msgId={} subject={} cause={} (ambiguous confirm)",
                    event.messageId(), subject, describe(cause));
            return DeliveryConfirm.unconfirmed();
        }
        if (cause instanceof IOException) {
            // status responses (e.g. 503 no stream for subject) surface as IOException
            throw new DeliveryRejectedException("Broker rejected msgId=" + event.messageId()
                    + ": " + describe(cause), cause);
        }
        throw new DeliveryRejectedException("Publish failed msgId=" + event.messageId() + ": " + describe(cause), cause);
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException
                || (current instanceof RuntimeException && current.getClass() == RuntimeException.class))
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable t) {
        return t == null ? "unknown" : (t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage());
    }

    @Override
    public StreamStatus streamStatus() {
        try {
            StreamInfo info = jsm.getStreamInfo(streamName);
            StreamConfiguration cfg = info.getConfiguration();
            StreamState state = info.getStreamState();
            return new StreamStatus(cfg.getName(),
                    cfg.getSubjects() == null ? List.of() : cfg.getSubjects(),
                    cfg.getStorageType() == null ? null : cfg.getStorageType().name(),
                    state == null ? 0L : state.getMsgCount(),
                    state == null ? 0L : state.getLastSequence());
        } catch (IOException e) {
            throw new BrokerConnectionException("Stream lookup failed: " + e.getMessage(), e);
        } catch (JetStreamApiException e) {
            throw new DeliveryRejectedException("Stream lookup rejected: " + e.getErrorDescription(), e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while closing broker connection");
        }
    }
}
