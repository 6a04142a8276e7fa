package com.social.violation.api;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;

import java.util.stream.Collectors;

/**
 * Maps failures to {@link ApiError}. Full detail is logged server-side only.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

	private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

	@ExceptionHandler(WebExchangeBindException.class)
	public ResponseEntity<ApiError> invalid(WebExchangeBindException e) {
		String msg = e.getFieldErrors().stream()
				.map(f -> f.getField() + " " + f.getDefaultMessage())
				.collect(Collectors.joining("; "));
		return ResponseEntity.badRequest().body(new ApiError("validation_failed", msg));
	}

	/** Failed constraints on query and path parameters. */
	@ExceptionHandler(ConstraintViolationException.class)
	public ResponseEntity<ApiError> invalidParameter(ConstraintViolationException e) {
		String msg = e.getConstraintViolations().stream()
				.map(v -> v.getPropertyPath() + " " + v.getMessage())
				.sorted()
				.collect(Collectors.joining("; "));
		return ResponseEntity.badRequest().body(new ApiError("validation_failed", msg));
	}

	/** Unreadable bodies and bad parameters. */
	@ExceptionHandler(ResponseStatusException.class)
	public ResponseEntity<ApiError> status(ResponseStatusException e) {
		String code = e.getStatusCode().is4xxClientError() ? "bad_request" : "internal_error";
		return ResponseEntity.status(e.getStatusCode()).body(new ApiError(code, e.getReason()));
	}

	@ExceptionHandler(IllegalArgumentException.class)
	public ResponseEntity<ApiError> badRequest(IllegalArgumentException e) {
		return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ApiError> internal(Exception e) {
		log.error("Request failed", e);
		return ResponseEntity.status(500).body(new ApiError("internal_error", "Request failed"));
	}
}
