package com.social.violation.core.escalation;

import com.social.violation.core.model.EscalationAction;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the {@code violation.events} notification payload and the
 * caller-facing detail message for each action.
 *
 * <p>Consumers render {@code title_template}/{@code body_template} as-is.</p>
 */
public final class NotificationTemplates {

    public static final String ROUTING_KEY = "violation.events";

    static final String WARNING_TITLE = "Community guidelines warning";
    static final String WARNING_BODY =
            "Your content was flagged: %s. You have %d violation(s). Please adhere to community guidelines.";
    static final String BAN_TITLE = "Account banned";
    static final String BAN_BODY =
            "Your account has been banned after %d violations. Latest violation: %s.";

    private NotificationTemplates() {
    }

    public static Map<String, Object> payload(EscalationAction action, String userId, String description,
                                              long violationCount) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event_type", action.eventType());
        payload.put("user_id", userId);
        payload.put("title_template", title(action));
        payload.put("body_template", body(action, description, violationCount));
        payload.put("violation_count", violationCount);
        payload.put("description", description);
        return payload;
    }

    public static String detail(EscalationAction action, String userId) {
        return switch (action) {
            case BAN -> "User " + userId + " has been banned: exceeded maximum number of violations.";
            case WARNING -> "Warning sent to user " + userId
                    + ": you have committed a violation. Please adhere to community guidelines.";
        };
    }

    static String title(EscalationAction action) {
        return action == EscalationAction.BAN ? BAN_TITLE : WARNING_TITLE;
    }

    static String body(EscalationAction action, String description, long violationCount) {
        return action == EscalationAction.BAN
                ? String.format(BAN_BODY, violationCount, description)
                : String.format(WARNING_BODY, description, violationCount);
    }
}
