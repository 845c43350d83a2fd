package org.javai.reconnect;

import java.util.Objects;

/**
 * Advice derived from a client's reconnection history, for diagnostics and telemetry.
 *
 * @param type What the advice is about
 * @param message Human-readable advice
 * @param priority How urgently the advice should be acted on
 */
public record Recommendation(Type type, String message, Priority priority) {

    public Recommendation {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
        Objects.requireNonNull(priority, "priority must not be null");
    }

    public enum Type {
        CONNECTION_METHOD("connection_method"),
        BACKOFF_STRATEGY("backoff_strategy"),
        TIMEOUT_ADJUSTMENT("timeout_adjustment");

        private final String key;

        Type(String key) {
            this.key = key;
        }

        public String key() {
            return key;
        }
    }

    public enum Priority {
        HIGH,
        MEDIUM,
        LOW
    }
}
