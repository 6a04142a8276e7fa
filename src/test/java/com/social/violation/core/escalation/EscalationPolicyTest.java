package com.social.violation.core.escalation;

import com.social.violation.core.model.EscalationAction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EscalationPolicyTest {

    @Test
    void bansAtTheThresholdNotAfterIt() {
        EscalationPolicy policy = new EscalationPolicy(3);

        assertEquals(EscalationAction.WARNING, policy.decide(1));
        assertEquals(EscalationAction.WARNING, policy.decide(2));
        assertEquals(EscalationAction.BAN, policy.decide(3));
        assertEquals(EscalationAction.BAN, policy.decide(4));
    }

    @Test
    void decisionIsMonotonicInTheCount() {
        EscalationPolicy policy = new EscalationPolicy(10);
        boolean banned = false;
        for (long count = 0; count <= 50; count++) {
            EscalationAction action = policy.decide(count);
            if (banned) {
                assertEquals(EscalationAction.BAN, action, "warned again at count " + count);
            }
            banned = action == EscalationAction.BAN;
            assertEquals(count >= 10, banned);
        }
    }

    @Test
    void thresholdOfOneBansOnFirstViolation() {
        assertEquals(EscalationAction.BAN, new EscalationPolicy(1).decide(1));
    }

    @Test
    void rejectsNonPositiveThreshold() {
        assertThrows(IllegalArgumentException.class, () -> new EscalationPolicy(0));
    }
}
