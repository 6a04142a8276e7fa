package com.social.violation.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Declarative definition of the durable stream that plays the role of the
 * {@code social.events} topic exchange.
 *
 * <p><b>Conceptual model</b></p>
 * <ul>
 *   <li>The exchange name is a subject prefix. A message for routing key
 *       {@code violation.events} is published on {@code social.events.violation.events}.</li>
 *   <li>The stream captures {@code <exchange>.>}, so every routing key under the exchange is
 *       stored durably regardless of which consumers exist.</li>
 *   <li>{@code File} storage keeps messages across broker restarts (persistent delivery).</li>
 * </ul>
 *
 * <p>
 * Configuration prefix: {@code moderation.broker.stream}
 * </p>
 */
@ConfigurationProperties(prefix = "moderation.broker.stream")
public class EventStreamProperties {

    /** Exchange name; doubles as the subject prefix. */
    private String exchange = "social.events";

    /** Stream name as registered in JetStream (no dots allowed by the server). */
    private String name = "SOCIAL_EVENTS";

    /**
     * Retention policy: {@code Limits} keeps messages for fan-out consumers until
     * {@link #maxAge} expires; {@code Interest} and {@code WorkQueue} are accepted too.
     */
    private String retentionPolicy = "Limits";

    /** {@code File} (durable, default) or {@code Memory}. */
    private String storageType = "File";

    private Duration maxAge = Duration.ofDays(7);

    private int replicas = 1;

    /**
     * Reaction to an existing stream whose configuration differs from this one.
     *
     * <p>{@code true}: the connect attempt fails. {@code false}: a warning is logged and
     * publishing continues against the existing stream. Existing streams are never modified.</p>
     */
    private boolean failOnMismatch = false;

    /**
     * Subject filter captured by the stream.
     */
    public List<String> subjects() {
        return List.of(exchange + ".>");
    }

    /**
     * Full subject for a routing key.
     */
    public String subjectFor(String routingKey) {
        return exchange + "." + routingKey;
    }

    public String getExchange() { return exchange; }
    public void setExchange(String exchange) { this.exchange = exchange; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getRetentionPolicy() { return retentionPolicy; }
    public void setRetentionPolicy(String retentionPolicy) { this.retentionPolicy = retentionPolicy; }

    public String getStorageType() { return storageType; }
    public void setStorageType(String storageType) { this.storageType = storageType; }

    public Duration getMaxAge() { return maxAge; }
    public void setMaxAge(Duration maxAge) { this.maxAge = maxAge; }

    public int getReplicas() { return replicas; }
    public void setReplicas(int replicas) { this.replicas = replicas; }

    public boolean isFailOnMismatch() { return failOnMismatch; }
    public void setFailOnMismatch(boolean failOnMismatch) { this.failOnMismatch = failOnMismatch; }
}
