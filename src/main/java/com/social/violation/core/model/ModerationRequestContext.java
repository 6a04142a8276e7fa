package com.social.violation.core.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Request-scoped data of the content being moderated.
 *
 * <p>Built by the entry point once per moderation request and passed
 * explicitly down to the escalation engine, so the caller that reports a
 * violation does not have to re-supply the original content.</p>
 *
 * @param userId       author of the content; required for reporting
 * @param textContent  text of the post or comment, may be {@code null}
 * @param imageContent decoded image bytes, may be {@code null}
 */
public record ModerationRequestContext(String userId, String textContent, byte[] imageContent) {

    public static ModerationRequestContext ofText(String userId, String textContent) {
        return new ModerationRequestContext(userId, textContent, null);
    }

    public ViolationType violationType() {
        return ViolationType.of(textContent, imageContent);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ModerationRequestContext other)) return false;
        return Objects.equals(userId, other.userId)
                && Objects.equals(textContent, other.textContent)
                && Arrays.equals(imageContent, other.imageContent);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(userId, textContent) + Arrays.hashCode(imageContent);
    }

    @Override
    public String toString() {
        return "ModerationRequestContext[userId=" + userId
                + ", textLength=" + (textContent == null ? 0 : textContent.length())
                + ", imageBytes=" + (imageContent == null ? 0 : imageContent.length) + "]";
    }
}
