package com.social.violation.jetstream.bootstrap;

import com.social.violation.jetstream.config.EventStreamProperties;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.api.StreamInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.*;

/**
 * =====================================================================
 * EventStreamDeclarer
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Declares the durable stream behind the {@code social.events} exchange.
 * The JetStream counterpart of an idempotent
 * {@code exchange_declare(durable=true, type=topic)}.
 *
 * WHEN THIS RUNS
 * --------------
 * On EVERY new broker connection, first connect and reconnect alike,
 * before the channel is handed to the publisher.
 *
 * BEHAVIOR
 * --------
 * - Stream exists     → validate it against the declared config
 * - Stream missing    → create it
 * - Any other failure → propagate (auth, connectivity)
 *
 * Existing streams are never updated. Drift either fails the declare
 * or is logged, depending on {@code fail-on-mismatch}.
 */
public class EventStreamDeclarer {

    private static final Logger log = LoggerFactory.getLogger(EventStreamDeclarer.class);

    /**
     * JetStream API error code for "stream not found".
     * Stable numeric code, never the message text.
     */
    static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private final EventStreamProperties props;

    public EventStreamDeclarer(EventStreamProperties props) {
        this.props = props;
    }

    public void declare(JetStreamManagement jsm) throws IOException, JetStreamApiException {
        StreamConfiguration desired = toStreamConfig(props);

        try {
            StreamInfo existing = jsm.getStreamInfo(desired.getName());
            validateExisting(desired, existing);
            return;
        } catch (JetStreamApiException e) {
            if (!isStreamNotFound(e)) {
                throw e;
            }
        }

        jsm.addStream(desired);

        log.info("Created JetStream stream: {} (subjects={}, maxAge={}, retention={}, storage={}, replicas={})",
                desired.getName(),
                desired.getSubjects(),
                desired.getMaxAge(),
                desired.getRetentionPolicy(),
                desired.getStorageType(),
                desired.getReplicas());
    }

    void validateExisting(StreamConfiguration desired, StreamInfo existing) {
        List<String> diffs = diff(desired, existing.getConfiguration());

        if (diffs.isEmpty()) {
            log.debug("JetStream stream exists and matches config: {}", desired.getName());
            return;
        }

        String msg = "JetStream stream exists but differs from expected: "
                + desired.getName() + " :: " + String.join("; ", diffs);

        if (props.isFailOnMismatch()) {
            throw new IllegalStateException(msg);
        }
        log.warn(msg);
    }

    static List<String> diff(StreamConfiguration desired, StreamConfiguration actual) {
        List<String> diffs = new ArrayList<>();

        if (!Objects.equals(actual.getRetentionPolicy(), desired.getRetentionPolicy())) {
            diffs.add("retentionPolicy actual=" + actual.getRetentionPolicy()
                    + " expected=" + desired.getRetentionPolicy());
        }
        if (!Objects.equals(actual.getStorageType(), desired.getStorageType())) {
            diffs.add("storageType actual=" + actual.getStorageType()
                    + " expected=" + desired.getStorageType());
        }
        if (!Objects.equals(actual.getMaxAge(), desired.getMaxAge())) {
            diffs.add("maxAge actual=" + actual.getMaxAge() + " expected=" + desired.getMaxAge());
        }
        if (actual.getReplicas() != desired.getReplicas()) {
            diffs.add("replicas actual=" + actual.getReplicas() + " expected=" + desired.getReplicas());
        }
        if (!setEquals(actual.getSubjects(), desired.getSubjects())) {
            diffs.add("subjects actual=" + actual.getSubjects() + " expected=" + desired.getSubjects());
        }
        return diffs;
    }

    private static boolean isStreamNotFound(JetStreamApiException e) {
        return e.getApiErrorCode() == JS_STREAM_NOT_FOUND_ERR;
    }

    /** Order-insensitive list comparison. */
    private static boolean setEquals(List<String> a, List<String> b) {
        Set<String> sa = new HashSet<>(a == null ? List.of() : a);
        Set<String> sb = new HashSet<>(b == null ? List.of() : b);
        return sa.equals(sb);
    }

    /**
     * The only place where properties are translated to a JetStream configuration.
     */
    static StreamConfiguration toStreamConfig(EventStreamProperties props) {
        String name = require(props.getName(), "name");
        require(props.getExchange(), "exchange");

        Duration maxAge = Objects.requireNonNull(props.getMaxAge(), "maxAge is required for stream " + name);

        return StreamConfiguration.builder()
                .name(name)
                .subjects(props.subjects().toArray(String[]::new))
                .retentionPolicy(parseRetentionPolicy(props.getRetentionPolicy()))
                .storageType(parseStorageType(props.getStorageType()))
                .maxAge(maxAge)
                .replicas(props.getReplicas())
                .build();
    }

    private static String require(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " is required");
        }
        return value;
    }

    /** Default: Limits (fan-out to any number of consumers). */
    static RetentionPolicy parseRetentionPolicy(String value) {
        if (value == null || value.isBlank()) {
            return RetentionPolicy.Limits;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "limits" -> RetentionPolicy.Limits;
            case "interest" -> RetentionPolicy.Interest;
            case "workqueue", "work_queue", "work-queue" -> RetentionPolicy.WorkQueue;
            default -> throw new IllegalArgumentException("Unsupported retentionPolicy: " + value);
        };
    }

    /** Default: File (persistent messages). */
    static StorageType parseStorageType(String value) {
        if (value == null || value.isBlank()) {
            return StorageType.File;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        return switch (v) {
            case "file" -> StorageType.File;
            case "memory" -> StorageType.Memory;
            default -> throw new IllegalArgumentException("Unsupported storageType: " + value);
        };
    }
}
