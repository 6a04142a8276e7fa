package com.social.violation.escalation;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Escalation policy and admin toggles.
 *
 * <p>Configuration prefix: {@code moderation}</p>
 */
@ConfigurationProperties(prefix = "moderation")
public class ModerationProperties {

    /** All-time violation count at which a user is banned. */
    private int banThreshold = 3;

    private Admin admin = new Admin();

    public int getBanThreshold() { return banThreshold; }
    public void setBanThreshold(int banThreshold) { this.banThreshold = banThreshold; }

    public Admin getAdmin() { return admin; }
    public void setAdmin(Admin admin) { this.admin = admin; }

    public static class Admin {

        /** Exposes /admin/broker/** when true. */
        private boolean enabled = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
