package com.social.violation.core.escalation;

import com.social.violation.core.model.EscalationAction;

/**
 * Threshold rule turning a user's all-time violation count into an action.
 *
 * <p>The comparison is {@code count >= banThreshold}: the violation that
 * reaches the threshold is the one that bans. There is no decay window.</p>
 */
public final class EscalationPolicy {

    private final int banThreshold;

    public EscalationPolicy(int banThreshold) {
        if (banThreshold < 1) {
            throw new IllegalArgumentException("banThreshold must be >= 1, was " + banThreshold);
        }
        this.banThreshold = banThreshold;
    }

    public EscalationAction decide(long violationCount) {
        return violationCount >= banThreshold ? EscalationAction.BAN : EscalationAction.WARNING;
    }

    public int banThreshold() {
        return banThreshold;
    }
}
