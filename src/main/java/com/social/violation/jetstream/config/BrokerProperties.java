package com.social.violation.jetstream.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the NATS server backing the event exchange.
 *
 * <h2>Binding</h2>
 * Properties are bound from Spring Boot config using the prefix {@code moderation.broker}, e.g.:
 * <pre>
 * moderation:
 *   broker:
 *     host: ${BROKER_HOST:localhost}
 *     port: ${BROKER_PORT:4222}
 *     user: ...
 *     password: ...
 *     token: ...
 *     creds: /path/to/user.creds
 *     tls: false
 *     connection-timeout: 2s
 * </pre>
 *
 * <h2>Operational notes</h2>
 * <ul>
 *   <li>Host and port are environment-supplied; the defaults target a local single-node server.</li>
 *   <li>Secrets (password/token) should come from environment variables or a secrets manager,
 *       never from committed config files.</li>
 * </ul>
 */
@ConfigurationProperties(prefix = "moderation.broker")
public class BrokerProperties {

    private String host = "localhost";

    private int port = 4222;

    /** Optional username for user/password authentication. */
    private String user;

    /** Treat as a secret; never logged. */
    private String password;

    /** Optional token for token-based authentication. */
    private String token;

    /** Optional path to a {@code .creds} file (NKey/JWT authentication). */
    private String creds;

    private boolean tls = false;

    /** Upper bound on establishing the TCP connection and handshake. */
    private Duration connectionTimeout = Duration.ofSeconds(2);

    /**
     * NATS server URL derived from host and port.
     */
    public String serverUrl() {
        return (tls ? "tls://" : "nats://") + host + ":" + port;
    }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public String getUser() { return user; }
    public void setUser(String user) { this.user = user; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public String getCreds() { return creds; }
    public void setCreds(String creds) { this.creds = creds; }

    public boolean isTls() { return tls; }
    public void setTls(boolean tls) { this.tls = tls; }

    public Duration getConnectionTimeout() { return connectionTimeout; }
    public void setConnectionTimeout(Duration connectionTimeout) { this.connectionTimeout = connectionTimeout; }
}
