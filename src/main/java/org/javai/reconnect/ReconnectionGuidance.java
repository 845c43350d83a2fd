package org.javai.reconnect;

import java.util.List;
import java.util.Objects;

/**
 * What the server tells a disconnected client about reconnecting.
 *
 * @param clientId The client the guidance is for
 * @param strategy The retry policy the client should follow
 * @param estimatedDelayMs Delay before the first attempt; 0 when no attempt is scheduled
 * @param maxAttempts Number of attempts the client should make
 * @param tips Advice from the client's history, highest priority first
 */
public record ReconnectionGuidance(
        String clientId,
        ReconnectionStrategy strategy,
        double estimatedDelayMs,
        int maxAttempts,
        List<String> tips
) {

    public ReconnectionGuidance {
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        tips = tips == null ? List.of() : List.copyOf(tips);
    }

    public boolean userActionRequired() {
        return strategy == ReconnectionStrategy.USER_PROMPT || maxAttempts == 0;
    }
}
