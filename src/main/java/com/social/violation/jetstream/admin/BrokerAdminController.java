package com.social.violation.jetstream.admin;

import com.social.violation.core.model.PublishOutcome;
import com.social.violation.core.publisher.EventPublisher;
import com.social.violation.jetstream.connection.BrokerChannel;
import com.social.violation.jetstream.connection.BrokerConnectionManager;
import com.social.violation.jetstream.publisher.FallbackEventLog;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Operational endpoints for the broker side of the pipeline.
 *
 * Production posture: - Disabled by default. - Should sit behind
 * authentication and/or network controls. - Publishing goes through the
 * regular {@link EventPublisher}, so retries and the fallback log apply.
 *
 * Enable explicitly: moderation.admin.enabled=true
 */
@RestController
@RequestMapping(path = "/admin/broker", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "moderation.admin", name = "enabled", havingValue = "true", matchIfMissing = false)
@Validated
public class BrokerAdminController {

	private static final Logger log = LoggerFactory.getLogger(BrokerAdminController.class);

	private final BrokerConnectionManager connections;
	private final EventPublisher publisher;
	private final FallbackEventLog fallbackLog;

	public BrokerAdminController(BrokerConnectionManager connections, EventPublisher publisher,
			FallbackEventLog fallbackLog) {
		this.connections = connections;
		this.publisher = publisher;
		this.fallbackLog = fallbackLog;
	}

	/**
	 * Connection state as last observed. Does not connect.
	 */
	@GetMapping("/health")
	public HealthResponse health() {
		return new HealthResponse(connections.state().name(), connections.connectCount(), Instant.now().toString());
	}

	/**
	 * 201 when delivered, 502 when the event ended up in the fallback log.
	 */
	@PostMapping(path = "/publish", consumes = MediaType.APPLICATION_JSON_VALUE)
	public Mono<ResponseEntity<PublishOutcome>> publish(@Valid @RequestBody PublishRequest req) {
		log.info("Admin publish key={}", req.routingKey());
		Map<String, Object> payload = req.payload() == null ? Map.of() : req.payload();
		return publisher.publish(req.routingKey().trim(), payload)
				.map(outcome -> ResponseEntity.status(outcome.delivered() ? 201 : 502).body(outcome));
	}

	/**
	 * Stream state from the server; connects if needed.
	 */
	@GetMapping("/stream")
	public Mono<BrokerChannel.StreamStatus> stream() {
		return Mono.fromCallable(() -> connections.withChannel(BrokerChannel::streamStatus))
				.subscribeOn(Schedulers.boundedElastic());
	}

	@GetMapping("/fallback")
	public Mono<FallbackResponse> fallback() {
		return Mono.fromCallable(() -> {
			List<String> lines = fallbackLog.readAll();
			return new FallbackResponse(fallbackLog.file().toString(), lines.size(), lines);
		}).subscribeOn(Schedulers.boundedElastic());
	}

	public record HealthResponse(String state, long connects, String timestamp) {
	}

	public record PublishRequest(@NotBlank String routingKey, Map<String, Object> payload) {
	}

	public record FallbackResponse(String file, int count, List<String> lines) {
	}
}
