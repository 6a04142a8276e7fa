package com.social.violation.app;

import com.social.violation.jetstream.connection.BrokerChannelFactory;
import com.social.violation.jetstream.connection.ScriptedBroker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(
        classes = {ViolationPipelineApplication.class, ViolationPipelineApplicationTest.FakeBrokerConfig.class},
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "spring.r2dbc.url=r2dbc:h2:mem:///violations-it?options=DB_CLOSE_DELAY=-1;DB_CLOSE_ON_EXIT=FALSE",
                "spring.r2dbc.username=sa",
                "spring.r2dbc.password=",
                "spring.sql.init.mode=always",
                "spring.sql.init.schema-locations=classpath:schema-h2.sql",
                "moderation.admin.enabled=true",
                "moderation.publisher.fallback-log=target/it-undelivered-events.jsonl"
        })
class ViolationPipelineApplicationTest {

    @TestConfiguration
    static class FakeBrokerConfig {

        @Bean
        @Primary
        ScriptedBroker scriptedBroker() {
            return new ScriptedBroker();
        }
    }

    @Autowired
    WebTestClient client;

    @Autowired
    ScriptedBroker broker;

    @Autowired
    BrokerChannelFactory channelFactory;

    private void report(String userId, String expectedAction) {
        client.post().uri("/api/moderation/violations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\":\"" + userId + "\",\"description\":\"spam\",\"textContent\":\"buy now\"}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.action").isEqualTo(expectedAction)
                .jsonPath("$.notification.delivered").isEqualTo(true);
    }

    @Test
    void thirdViolationBansAndEveryDecisionIsPublished() {
        assertSame(broker, channelFactory);

        report("u-it", "WARNING");
        report("u-it", "WARNING");
        report("u-it", "BAN");

        client.get().uri("/api/moderation/users/u-it/violations/count")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.violationCount").isEqualTo(3);

        assertEquals(3, broker.publishes());
        assertTrue(broker.subjects().stream().allMatch("social.events.violation.events"::equals));
        assertTrue(broker.bodies().get(2).contains("\"event_type\":\"user_banned\""));

        client.get().uri("/admin/broker/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state").isEqualTo("CONNECTED");

        client.get().uri("/admin/broker/stream")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.name").isEqualTo("SOCIAL_EVENTS");
    }

    @Test
    void outOfRangeLimitIsRejected() {
        client.get().uri("/api/moderation/users/u-it/violations?limit=-1")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("validation_failed");

        client.get().uri("/api/moderation/users/u-it/violations?limit=501")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("validation_failed");
    }
}
