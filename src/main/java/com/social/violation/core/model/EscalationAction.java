package com.social.violation.core.model;

/**
 * User-facing action chosen for a recorded violation.
 */
public enum EscalationAction {

    WARNING("user_warning"),

    BAN("user_banned");

    private final String eventType;

    EscalationAction(String eventType) {
        this.eventType = eventType;
    }

    /** Value of the {@code event_type} field in the notification payload. */
    public String eventType() {
        return eventType;
    }
}
