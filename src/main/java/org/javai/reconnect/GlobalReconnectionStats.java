package org.javai.reconnect;

import java.time.Instant;
import java.util.Objects;

/**
 * Process-wide reconnection counters.
 *
 * <p>{@code averageReconnectionTimeMs} is a smoothed value, updated as
 * {@code (previous + sample) / 2} on every tracked attempt. It is not an arithmetic mean.
 *
 * @param totalAttempts Attempts tracked across all clients
 * @param successfulReconnections Attempts that reconnected
 * @param failedReconnections Attempts that did not reconnect
 * @param averageReconnectionTimeMs Smoothed attempt duration, in milliseconds
 * @param activeClients Clients with retained state at the time of the snapshot
 * @param lastUpdated When the snapshot was taken
 */
public record GlobalReconnectionStats(
        long totalAttempts,
        long successfulReconnections,
        long failedReconnections,
        double averageReconnectionTimeMs,
        int activeClients,
        Instant lastUpdated
) {

    public GlobalReconnectionStats {
        Objects.requireNonNull(lastUpdated, "lastUpdated must not be null");
    }

    /**
     * Fraction of tracked attempts that reconnected, or 0 before any attempt.
     */
    public double successRate() {
        return totalAttempts == 0 ? 0 : (double) successfulReconnections / totalAttempts;
    }
}
