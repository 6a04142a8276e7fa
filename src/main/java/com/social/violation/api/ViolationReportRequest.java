package com.social.violation.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * A flagged piece of content, as handed over by the moderation classifier.
 *
 * @param imageBase64 optional image, standard base64
 */
public record ViolationReportRequest(
        @NotBlank @Size(max = 64) String userId,
        @NotBlank String description,
        String textContent,
        String imageBase64
) {}
