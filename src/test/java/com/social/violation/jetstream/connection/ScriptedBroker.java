package com.social.violation.jetstream.connection;

import com.social.violation.core.model.OutboundEvent;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * In-memory broker for tests. Each publish consumes the next scripted step;
 * once the script is empty every publish is acked.
 */
public class ScriptedBroker implements BrokerChannelFactory {

    private final Deque<Supplier<DeliveryConfirm>> steps = new ConcurrentLinkedDeque<>();
    private final Deque<RuntimeException> openFailures = new ConcurrentLinkedDeque<>();
    private final AtomicInteger opens = new AtomicInteger();
    private final AtomicInteger openAttempts = new AtomicInteger();
    private final AtomicInteger sequence = new AtomicInteger();

    private final List<String> messageIds = Collections.synchronizedList(new ArrayList<>());
    private final List<String> subjects = Collections.synchronizedList(new ArrayList<>());
    private final List<String> bodies = Collections.synchronizedList(new ArrayList<>());

    private volatile Channel current;

    public ScriptedBroker failOpen(int times, String message) {
        for (int i = 0; i < times; i++) {
            openFailures.add(new BrokerConnectionException(message));
        }
        return this;
    }

    public ScriptedBroker thenAck() {
        steps.add(this::ack);
        return this;
    }

    public ScriptedBroker thenAmbiguous() {
        steps.add(DeliveryConfirm::unconfirmed);
        return this;
    }

    public ScriptedBroker thenReject(String message) {
        steps.add(() -> {
            throw new DeliveryRejectedException(message);
        });
        return this;
    }

    /** The publish fails and the channel reports itself closed afterwards. */
    public ScriptedBroker thenDropConnection(String message) {
        steps.add(() -> {
            Channel ch = current;
            if (ch != null) {
                ch.open = false;
            }
            throw new BrokerConnectionException(message);
        });
        return this;
    }

    public ScriptedBroker alwaysReject(int times, String message) {
        for (int i = 0; i < times; i++) {
            thenReject(message);
        }
        return this;
    }

    /** Closes the current channel without a publish, as a broker restart would. */
    public void closeCurrent() {
        Channel ch = current;
        if (ch != null) {
            ch.open = false;
        }
    }

    @Override
    public BrokerChannel open() {
        openAttempts.incrementAndGet();
        RuntimeException failure = openFailures.poll();
        if (failure != null) {
            throw failure;
        }
        opens.incrementAndGet();
        Channel ch = new Channel();
        current = ch;
        return ch;
    }

    private DeliveryConfirm ack() {
        return DeliveryConfirm.acked("SOCIAL_EVENTS", sequence.incrementAndGet(), false);
    }

    public int opens() {
        return opens.get();
    }

    public int openAttempts() {
        return openAttempts.get();
    }

    /** Publish attempts that reached an open channel. */
    public int publishes() {
        return messageIds.size();
    }

    public List<String> messageIds() {
        synchronized (messageIds) {
            return List.copyOf(messageIds);
        }
    }

    public List<String> subjects() {
        synchronized (subjects) {
            return List.copyOf(subjects);
        }
    }

    public List<String> bodies() {
        synchronized (bodies) {
            return List.copyOf(bodies);
        }
    }

    private final class Channel implements BrokerChannel {

        private volatile boolean open = true;
        private volatile boolean closed;

        @Override
        public boolean isOpen() {
            return open && !closed;
        }

        @Override
        public DeliveryConfirm publish(String subject, OutboundEvent event, byte[] body) {
            messageIds.add(event.messageId());
            subjects.add(subject);
            bodies.add(new String(body, StandardCharsets.UTF_8));
            Supplier<DeliveryConfirm> step = steps.poll();
            return step == null ? ack() : step.get();
        }

        @Override
        public StreamStatus streamStatus() {
            return new StreamStatus("SOCIAL_EVENTS", List.of("social.events.>"), "File",
                    sequence.get(), sequence.get());
        }

        @Override
        public void close() {
            closed = true;
        }
    }
}
