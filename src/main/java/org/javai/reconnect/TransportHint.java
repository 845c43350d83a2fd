package org.javai.reconnect;

/**
 * Transport the client should use for a scheduled attempt.
 */
public enum TransportHint {
    WEBSOCKET("websocket"),
    POLLING("polling");

    private final String wireName;

    TransportHint(String wireName) {
        this.wireName = wireName;
    }

    /**
     * The name the real-time transport layer uses for this transport.
     */
    public String wireName() {
        return wireName;
    }
}
