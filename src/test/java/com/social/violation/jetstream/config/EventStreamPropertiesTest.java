package com.social.violation.jetstream.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class EventStreamPropertiesTest {

    @Test
    void routingKeyIsAppendedToTheExchangePrefix() {
        EventStreamProperties props = new EventStreamProperties();

        assertEquals("social.events.violation.events", props.subjectFor("violation.events"));
        assertEquals(List.of("social.events.>"), props.subjects());
    }
}
