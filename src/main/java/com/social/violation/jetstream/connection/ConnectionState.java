package com.social.violation.jetstream.connection;

/**
 * Lifecycle of the shared broker connection.
 *
 * <pre>
 *   DISCONNECTED ──open──▶ CONNECTING ──ok──▶ CONNECTED
 *        ▲                     │                  │
 *        └──────connect failed─┘                  │
 *        └──────────closure / connection error────┘
 * </pre>
 *
 * There is no terminal state: the manager reconnects on demand for the whole
 * life of the process.
 */
public enum ConnectionState {

    DISCONNECTED,

    CONNECTING,

    CONNECTED
}
