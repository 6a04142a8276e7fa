package com.social.violation.core.model;

/**
 * Whether a reported violation made it into the audit store and was counted.
 */
public enum RecordStatus {

    /** Record persisted and the user's total was read back. */
    RECORDED,

    /** Validation, persistence or count failed; no decision was taken. */
    ERROR
}
