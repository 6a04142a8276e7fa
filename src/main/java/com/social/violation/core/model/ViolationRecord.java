package com.social.violation.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * =====================================================================
 * ViolationRecord
 * =====================================================================
 *
 * One row per reported violation. Created once by the escalation engine,
 * never mutated, kept indefinitely as the audit trail.
 *
 * {@code textContent} and {@code imageContent} hold the offending content as
 * it arrived; either may be null. The escalation engine never holds a record
 * beyond the call that created it; counts are always re-read from the store.
 */
public record ViolationRecord(

        UUID id,

        /** Opaque identifier of the offending user. */
        String userId,

        ViolationType violationType,

        /** Human-readable explanation produced by the classifier. */
        String description,

        String textContent,

        byte[] imageContent,

        /** Assigned by the store, strictly increasing per store instance. */
        Instant createdAt) {

    /**
     * A record that has not been persisted yet (no id, no timestamp).
     */
    public static ViolationRecord draft(String userId, String description, String textContent, byte[] imageContent) {
        return new ViolationRecord(null, userId, ViolationType.of(textContent, imageContent),
                description, textContent, imageContent, null);
    }

    public ViolationRecord withIdentity(UUID id, Instant createdAt) {
        return new ViolationRecord(id, userId, violationType, description, textContent, imageContent, createdAt);
    }
}
