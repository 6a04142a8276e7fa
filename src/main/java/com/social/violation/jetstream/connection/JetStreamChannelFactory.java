package com.social.violation.jetstream.connection;

import com.social.violation.jetstream.bootstrap.EventStreamDeclarer;
import com.social.violation.jetstream.config.BrokerProperties;
import com.social.violation.jetstream.config.EventStreamProperties;
import com.social.violation.jetstream.config.PublisherProperties;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Opens NATS connections and prepares them for confirmed publishing.
 *
 * <h2>Connection strategy</h2>
 * <ol>
 *   <li>Build {@link Options} from {@link BrokerProperties} (auth and TLS only when configured).</li>
 *   <li>Disable the client's own reconnect loop; closure is detected by the connection manager,
 *       which reconnects through this factory.</li>
 *   <li>Create the JetStream contexts and declare the event stream.</li>
 *   <li>On any failure after the socket is up, close it again before reporting the error.</li>
 * </ol>
 */
public class JetStreamChannelFactory implements BrokerChannelFactory {

    private static final Logger log = LoggerFactory.getLogger(JetStreamChannelFactory.class);

    private static final String CONNECTION_NAME = "violation-pipeline";

    private final BrokerProperties broker;
    private final EventStreamProperties stream;
    private final PublisherProperties publisher;
    private final EventStreamDeclarer declarer;

    public JetStreamChannelFactory(BrokerProperties broker, EventStreamProperties stream,
                                   PublisherProperties publisher, EventStreamDeclarer declarer) {
        this.broker = broker;
        this.stream = stream;
        this.publisher = publisher;
        this.declarer = declarer;
    }

    @Override
    public BrokerChannel open() {
        String url = broker.serverUrl();
        Connection connection;
        try {
            connection = Nats.connect(buildOptions(url));
        } catch (IOException e) {
            throw new BrokerConnectionException("Could not establish connection to broker at " + url
                    + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectionException("Interrupted while connecting to broker at " + url, e);
        } catch (RuntimeException e) {
            throw new BrokerConnectionException("Invalid broker options for " + url + ": " + e.getMessage(), e);
        }

        try {
            JetStream js = connection.jetStream();
            JetStreamManagement jsm = connection.jetStreamManagement();
            declarer.declare(jsm);

            log.info("Connected to broker (url={}, tls={}, user={}, stream={})",
                    url, broker.isTls(), mask(broker.getUser()), stream.getName());

            return new JetStreamBrokerChannel(connection, js, jsm, stream.getName(), publisher.getConfirmTimeout());
        } catch (IOException | JetStreamApiException | RuntimeException e) {
            closeQuietly(connection);
            throw new BrokerConnectionException("Failed to declare stream " + stream.getName()
                    + ": " + e.getMessage(), e);
        }
    }

    Options buildOptions(String url) {
        Options.Builder builder = new Options.Builder()
                .server(url)
                .connectionName(CONNECTION_NAME)
                .connectionTimeout(broker.getConnectionTimeout())
                .noReconnect();

        if (hasText(broker.getToken())) {
            builder.token(broker.getToken().toCharArray());
        }
        if (hasText(broker.getUser())) {
            String pass = broker.getPassword() == null ? "" : broker.getPassword();
            builder.userInfo(broker.getUser(), pass);
        }
        if (hasText(broker.getCreds())) {
            builder.authHandler(Nats.credentials(broker.getCreds()));
        }
        return builder.build();
    }

    private static void closeQuietly(Connection connection) {
        try {
            connection.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.debug("Ignoring failure while closing half-open connection: {}", e.getMessage());
        }
    }

    private static boolean hasText(String v) {
        return v != null && !v.isBlank();
    }

    /**
     * Masks an identifier for logging. Example: "admin" -> "a***n".
     */
    static String mask(String v) {
        if (v == null || v.isBlank()) return "";
        if (v.length() <= 2) return "**";
        return v.substring(0, 1) + "***" + v.substring(v.length() - 1);
    }
}
