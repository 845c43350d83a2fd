package org.javai.reconnect;

import java.util.Objects;

/**
 * Emitted after every tracked reconnection attempt.
 *
 * @param clientId The client the attempt belongs to
 * @param attempt The attempt that was tracked
 * @param state The client's state after the attempt was recorded
 */
public record AttemptTrackedEvent(String clientId, AttemptRecord attempt, ClientReconnectionState state) {

    public AttemptTrackedEvent {
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");
        Objects.requireNonNull(state, "state must not be null");
    }
}
