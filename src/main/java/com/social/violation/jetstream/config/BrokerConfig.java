package com.social.violation.jetstream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.social.violation.jetstream.bootstrap.EventStreamDeclarer;
import com.social.violation.jetstream.connection.BrokerChannelFactory;
import com.social.violation.jetstream.connection.BrokerConnectionManager;
import com.social.violation.jetstream.connection.JetStreamChannelFactory;
import com.social.violation.jetstream.publisher.FallbackEventLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration that wires up the broker side of the pipeline:
 * <ul>
 *   <li>stream declaration ({@link EventStreamDeclarer})</li>
 *   <li>the channel factory that opens NATS connections</li>
 *   <li>the shared {@link BrokerConnectionManager}</li>
 *   <li>the {@link FallbackEventLog}</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * No connection is opened at startup. The first publish connects; the manager closes itself on
 * application shutdown ({@code DisposableBean}). The application therefore starts even when the broker is down.
 *
 * <h2>Tests</h2>
 * {@link BrokerChannelFactory} is {@link ConditionalOnMissingBean}, so a test context can supply
 * an in-memory channel factory instead of a real broker.
 */
@Configuration
@EnableConfigurationProperties({
        BrokerProperties.class,        // host, port, auth, tls
        EventStreamProperties.class,   // exchange prefix and stream settings
        PublisherProperties.class      // retries, backoff, confirm timeout, fallback log
})
public class BrokerConfig {

    private static final Logger log = LoggerFactory.getLogger(BrokerConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventStreamDeclarer eventStreamDeclarer(EventStreamProperties stream) {
        return new EventStreamDeclarer(stream);
    }

    @Bean
    @ConditionalOnMissingBean(BrokerChannelFactory.class)
    public BrokerChannelFactory brokerChannelFactory(BrokerProperties broker,
                                                     EventStreamProperties stream,
                                                     PublisherProperties publisher,
                                                     EventStreamDeclarer declarer) {
        log.info("Broker configured (url={}, stream={}, subjects={})",
                broker.serverUrl(), stream.getName(), stream.subjects());
        return new JetStreamChannelFactory(broker, stream, publisher, declarer);
    }

    @Bean
    public BrokerConnectionManager brokerConnectionManager(BrokerChannelFactory factory) {
        return new BrokerConnectionManager(factory);
    }

    @Bean
    public FallbackEventLog fallbackEventLog(PublisherProperties publisher, ObjectMapper mapper, Clock clock) {
        return new FallbackEventLog(publisher.getFallbackLog(), mapper, clock);
    }
}
