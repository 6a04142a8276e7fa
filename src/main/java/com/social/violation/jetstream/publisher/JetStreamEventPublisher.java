package com.social.violation.jetstream.publisher;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.violation.core.model.OutboundEvent;
import com.social.violation.core.model.PublishOutcome;
import com.social.violation.core.publisher.EventPublisher;
import com.social.violation.jetstream.config.EventStreamProperties;
import com.social.violation.jetstream.config.PublisherProperties;
import com.social.violation.jetstream.connection.BrokerConnectionException;
import com.social.violation.jetstream.connection.BrokerConnectionManager;
import com.social.violation.jetstream.connection.DeliveryConfirm;
import com.social.violation.jetstream.connection.DeliveryRejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reactive JetStream publisher with confirms, retries and a fallback log.
 *
 * <h2>Flow of one call</h2>
 * <ol>
 *   <li>Build the {@link OutboundEvent}: one fresh message id for the whole call.</li>
 *   <li>Serialize the payload once. Invalid input is not retried; it goes straight to the fallback log.</li>
 *   <li>Attempt: through {@link BrokerConnectionManager#withChannel}, which reconnects (and re-declares the
 *       stream) when needed, then publish and wait for the ack.</li>
 *   <li>On failure, wait {@code base * 2^(k-1)} before attempt {@code k} and try again, up to
 *       {@code maxRetries} retries.</li>
 *   <li>On exhaustion, append the event to the {@link FallbackEventLog} and report failure.</li>
 * </ol>
 *
 * <h2>Threading / Reactive behavior</h2>
 * The broker call blocks (network round trip plus ack wait), so each attempt runs on
 * {@link Schedulers#boundedElastic()}. Backoff waits use {@code Mono.delay} and do not hold the
 * connection lock. Once started, a retry loop runs to success or exhaustion.
 *
 * <h2>Logging</h2>
 * Logs acks (stream and sequence), ambiguous confirms, each retry with its failure kind, and give-ups.
 */
@Component
public class JetStreamEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(JetStreamEventPublisher.class);

    private final BrokerConnectionManager connections;
    private final EventStreamProperties stream;
    private final PublisherProperties props;
    private final FallbackEventLog fallbackLog;
    private final ObjectMapper mapper;
    private final Clock clock;

    public JetStreamEventPublisher(BrokerConnectionManager connections,
                                   EventStreamProperties stream,
                                   PublisherProperties props,
                                   FallbackEventLog fallbackLog,
                                   ObjectMapper mapper,
                                   Clock clock) {
        this.connections = connections;
        this.stream = stream;
        this.props = props;
        this.fallbackLog = fallbackLog;
        this.mapper = mapper;
        this.clock = clock;
    }

    @Override
    public Mono<PublishOutcome> publish(String routingKey, Map<String, Object> payload) {
        return Mono.defer(() -> {
            OutboundEvent event = OutboundEvent.create(routingKey, payload, clock.instant());

            byte[] body;
            try {
                body = encode(event);
            } catch (IllegalArgumentException e) {
                return giveUp(event, e.getMessage(), 0);
            }

            String subject = stream.subjectFor(routingKey);
            AtomicInteger attempts = new AtomicInteger();

            return Mono.fromCallable(() -> attemptOnce(subject, event, body, attempts.incrementAndGet()))
                    .subscribeOn(Schedulers.boundedElastic())
                    .retryWhen(backoff(event))
                    .map(confirm -> PublishOutcome.success(event.messageId(), attempts.get()))
                    .onErrorResume(err -> giveUp(event, describe(err), attempts.get()));
        });
    }

    private DeliveryConfirm attemptOnce(String subject, OutboundEvent event, byte[] body, int attempt) {
        DeliveryConfirm confirm = connections.withChannel(ch -> ch.publish(subject, event, body));

        if (confirm.ambiguous()) {
            log.warn("Publish confirm ambiguous, treating as delivered msgId={} key={} attempt={}",
                    event.messageId(), event.routingKey(), attempt);
        } else {
            log.info("Published event msgId={} key={} stream={} seq={} duplicate={} attempt={}",
                    event.messageId(), event.routingKey(), confirm.stream(), confirm.sequence(),
                    confirm.duplicate(), attempt);
        }
        return confirm;
    }

    /**
     * Exponential backoff driven by {@link PublisherProperties#delayBeforeAttempt(int)}.
     * Errors past the budget are re-emitted as-is so the last failure message reaches the caller.
     */
    private Retry backoff(OutboundEvent event) {
        int maxRetries = Math.max(0, props.getMaxRetries());
        return Retry.from(signals -> signals.concatMap(signal -> {
            Throwable failure = signal.failure();
            int nextAttempt = (int) signal.totalRetries() + 1;
            if (nextAttempt > maxRetries) {
                return Mono.error(failure);
            }
            Duration delay = props.delayBeforeAttempt(nextAttempt);
            log.warn("Publish failed msgId={} key={} kind={} err={}; retry {}/{} in {}",
                    event.messageId(), event.routingKey(), kindOf(failure), describe(failure),
                    nextAttempt, maxRetries, delay);
            return Mono.delay(delay).thenReturn(nextAttempt);
        }));
    }

    private Mono<PublishOutcome> giveUp(OutboundEvent event, String detail, int attempts) {
        return Mono.fromCallable(() -> {
                    log.error("Giving up on event msgId={} key={} after {} attempt(s): {}",
                            event.messageId(), event.routingKey(), attempts, detail);
                    fallbackLog.append(event);
                    return PublishOutcome.failure(event.messageId(), detail, attempts);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    private byte[] encode(OutboundEvent event) {
        if (event.routingKey() == null || event.routingKey().isBlank()) {
            throw new IllegalArgumentException("routingKey must not be blank");
        }
        try {
            return mapper.writeValueAsBytes(event.payload());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Payload is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    static String kindOf(Throwable t) {
        if (t instanceof BrokerConnectionException) return "connection";
        if (t instanceof DeliveryRejectedException) return "rejected";
        return "error";
    }

    private static String describe(Throwable t) {
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}
