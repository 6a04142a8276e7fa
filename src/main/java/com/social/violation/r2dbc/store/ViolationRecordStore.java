package com.social.violation.r2dbc.store;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Repository;

import com.social.violation.core.model.ViolationRecord;
import com.social.violation.core.model.ViolationType;

import io.r2dbc.spi.Row;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Database access helper for the violations table.
 *
 * Timestamps are bound as OffsetDateTime (UTC) so both Postgres TIMESTAMPTZ and
 * H2 TIMESTAMP WITH TIME ZONE accept them. created_at is truncated to
 * microseconds and strictly increasing per store instance.
 */
@Repository
public class ViolationRecordStore {

	private final DatabaseClient db;
	private final Clock clock;
	private final AtomicReference<Instant> lastCreatedAt = new AtomicReference<>(Instant.EPOCH);

	public ViolationRecordStore(DatabaseClient db, Clock clock) {
		this.db = db;
		this.clock = clock;
	}

	public Mono<ViolationRecord> insert(ViolationRecord draft) {
		return Mono.defer(() -> {
			UUID id = UUID.randomUUID();
			Instant createdAt = nextCreatedAt();

			String sql = "INSERT INTO violations (id, user_id, violation_type, description, text_content, image_content, created_at) "
					+ "VALUES (:id, :user_id, :violation_type, :description, :text_content, :image_content, :created_at)";

			DatabaseClient.GenericExecuteSpec spec = db.sql(sql).bind("id", id).bind("user_id", draft.userId())
					.bind("violation_type", draft.violationType().name()).bind("description", draft.description())
					.bind("created_at", OffsetDateTime.ofInstant(createdAt, ZoneOffset.UTC));

			if (draft.textContent() == null) {
				spec = spec.bindNull("text_content", String.class);
			} else {
				spec = spec.bind("text_content", draft.textContent());
			}
			if (draft.imageContent() == null) {
				spec = spec.bindNull("image_content", byte[].class);
			} else {
				spec = spec.bind("image_content", draft.imageContent());
			}

			return spec.fetch().rowsUpdated().thenReturn(draft.withIdentity(id, createdAt));
		});
	}

	public Mono<Long> countByUser(String userId) {
		String sql = "SELECT COUNT(*) FROM violations WHERE user_id = :user_id";
		return db.sql(sql).bind("user_id", userId).map((row, meta) -> toLong(row.get(0))).one()
				.defaultIfEmpty(0L);
	}

	/**
	 * Newest first. Image bytes are not loaded; the listing is an audit view.
	 */
	public Flux<ViolationRecord> findByUser(String userId, int limit) {
		String sql = "SELECT id, user_id, violation_type, description, text_content, created_at "
				+ "FROM violations WHERE user_id = :user_id ORDER BY created_at DESC LIMIT :limit";

		return db.sql(sql).bind("user_id", userId).bind("limit", limit).map((row, meta) -> toModel(row)).all();
	}

	private ViolationRecord toModel(Row row) {
		OffsetDateTime created = row.get("created_at", OffsetDateTime.class);
		return new ViolationRecord(row.get("id", UUID.class), row.get("user_id", String.class),
				parseType(row.get("violation_type", String.class)), row.get("description", String.class),
				row.get("text_content", String.class), null, created == null ? null : created.toInstant());
	}

	private Instant nextCreatedAt() {
		Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
		return lastCreatedAt.updateAndGet(prev -> now.isAfter(prev) ? now : prev.plus(1, ChronoUnit.MICROS));
	}

	private static ViolationType parseType(String v) {
		if (v == null) {
			return ViolationType.UNKNOWN;
		}
		try {
			return ViolationType.valueOf(v);
		} catch (IllegalArgumentException e) {
			return ViolationType.UNKNOWN;
		}
	}

	private static long toLong(Object v) {
		if (v instanceof Number n) {
			return n.longValue();
		}
		throw new IllegalStateException("Unexpected count value: " + v);
	}
}
