package com.social.violation.api;

public record ApiError(String code, String message) {
}
