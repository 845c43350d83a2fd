package org.javai.reconnect;

/**
 * Categorical reason a client connection dropped.
 */
public enum DisconnectCause {
    /**
     * Heartbeat or connect handshake did not complete in time.
     */
    NETWORK_TIMEOUT,

    /**
     * The underlying transport (websocket, long-polling) closed or errored.
     */
    TRANSPORT_ERROR,

    /**
     * The client asked to disconnect.
     */
    USER_INITIATED,

    /**
     * The server closed the connection, usually for a restart or an internal error.
     */
    SERVER_SHUTDOWN,

    /**
     * The client's credentials were rejected. Retrying will not help.
     */
    AUTHENTICATION_FAILURE,

    /**
     * The server refused the connection because a resource limit was reached.
     */
    RESOURCE_EXHAUSTION,

    /**
     * No known reason matched.
     */
    UNKNOWN
}
