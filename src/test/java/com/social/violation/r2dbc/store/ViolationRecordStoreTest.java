package com.social.violation.r2dbc.store;

import com.social.violation.core.model.ViolationRecord;
import com.social.violation.core.model.ViolationType;
import io.r2dbc.h2.H2ConnectionFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.r2dbc.core.DatabaseClient;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ViolationRecordStoreTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-10T06:13:20Z"), ZoneOffset.UTC);

    private DatabaseClient db;
    private ViolationRecordStore store;

    @BeforeEach
    void setUp() throws IOException {
        db = DatabaseClient.create(H2ConnectionFactory.inMemory("violations-" + UUID.randomUUID()));
        Flux.fromIterable(statements("/schema-h2.sql"))
                .concatMap(sql -> db.sql(sql).fetch().rowsUpdated())
                .blockLast();
        store = new ViolationRecordStore(db, clock);
    }

    private static List<String> statements(String resource) throws IOException {
        try (InputStream in = ViolationRecordStoreTest.class.getResourceAsStream(resource)) {
            String script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return Arrays.stream(script.split(";"))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        }
    }

    @Test
    void insertAssignsIdentityAndTimestamp() {
        ViolationRecord draft = ViolationRecord.draft("u-1", "hate speech", "bad words", new byte[] {1, 2});

        StepVerifier.create(store.insert(draft))
                .assertNext(saved -> {
                    assertNotNull(saved.id());
                    assertEquals(clock.instant(), saved.createdAt());
                    assertEquals(ViolationType.TEXT_AND_IMAGE, saved.violationType());
                    assertEquals("u-1", saved.userId());
                })
                .verifyComplete();
    }

    @Test
    void countsPerUserIncludingTheLatestInsert() {
        store.insert(ViolationRecord.draft("u-1", "a", "t", null)).block();
        store.insert(ViolationRecord.draft("u-1", "b", null, new byte[] {9})).block();
        store.insert(ViolationRecord.draft("u-2", "c", "t", null)).block();

        assertEquals(2L, store.countByUser("u-1").block());
        assertEquals(1L, store.countByUser("u-2").block());
        assertEquals(0L, store.countByUser("nobody").block());
    }

    @Test
    void findByUserIsNewestFirstWithoutImageBytes() {
        ViolationRecord first = store.insert(ViolationRecord.draft("u-1", "first", "t1", new byte[] {7})).block();
        ViolationRecord second = store.insert(ViolationRecord.draft("u-1", "second", null, null)).block();
        ViolationRecord third = store.insert(ViolationRecord.draft("u-1", "third", "t3", null)).block();

        assertTrue(second.createdAt().isAfter(first.createdAt()));
        assertTrue(third.createdAt().isAfter(second.createdAt()));

        List<ViolationRecord> listed = store.findByUser("u-1", 2).collectList().block();

        assertEquals(2, listed.size());
        assertEquals(third.id(), listed.get(0).id());
        assertEquals(second.id(), listed.get(1).id());
        assertEquals(ViolationType.UNKNOWN, listed.get(1).violationType());
        assertNull(listed.get(1).textContent());
        assertNull(listed.get(0).imageContent());
        assertEquals(third.createdAt(), listed.get(0).createdAt());
    }
}
