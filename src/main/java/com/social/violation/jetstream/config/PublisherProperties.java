package com.social.violation.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Retry, confirmation and fallback settings for the event publisher.
 *
 * <p>Defaults: 3 retries (4 attempts in total) with delays of 1s, 2s and 4s
 * between attempts. A call that never succeeds waits 7s plus connect and
 * confirm time before it gives up.</p>
 *
 * <p>Configuration prefix: {@code moderation.publisher}</p>
 */
@ConfigurationProperties(prefix = "moderation.publisher")
public class PublisherProperties {

    /** Retries after the first attempt. */
    private int maxRetries = 3;

    /** Delay before the first retry; doubled for every retry after it. */
    private Duration backoffBase = Duration.ofSeconds(1);

    /** How long one attempt waits for the broker's publish ack. */
    private Duration confirmTimeout = Duration.ofSeconds(5);

    /** Append-only JSON-lines file for events that could not be delivered. */
    private Path fallbackLog = Path.of("logs", "undelivered-events.jsonl");

    /**
     * Delay before the given attempt; attempt 0 has none.
     */
    public Duration delayBeforeAttempt(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        return backoffBase.multipliedBy(1L << (attempt - 1));
    }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Duration getBackoffBase() { return backoffBase; }
    public void setBackoffBase(Duration backoffBase) { this.backoffBase = backoffBase; }

    public Duration getConfirmTimeout() { return confirmTimeout; }
    public void setConfirmTimeout(Duration confirmTimeout) { this.confirmTimeout = confirmTimeout; }

    public Path getFallbackLog() { return fallbackLog; }
    public void setFallbackLog(Path fallbackLog) { this.fallbackLog = fallbackLog; }
}
