package com.social.violation.core.model;

/**
 * Kind of content a violation was raised against, derived from which parts of
 * the originating request were present.
 */
public enum ViolationType {

    TEXT,

    IMAGE,

    TEXT_AND_IMAGE,

    /** Neither text nor image was available in the request context. */
    UNKNOWN;

    public static ViolationType of(String textContent, byte[] imageContent) {
        boolean hasText = textContent != null && !textContent.isBlank();
        boolean hasImage = imageContent != null && imageContent.length > 0;
        if (hasText && hasImage) return TEXT_AND_IMAGE;
        if (hasText) return TEXT;
        if (hasImage) return IMAGE;
        return UNKNOWN;
    }
}
