package org.javai.reconnect;

/**
 * Outcome of a single reconnection attempt, as reported by the transport layer.
 *
 * @param attempt The attempt number within its schedule
 * @param success Whether the client reconnected
 * @param durationMs How long the attempt took, in milliseconds
 * @param timestamp When the attempt was tracked, in epoch milliseconds
 */
public record AttemptRecord(int attempt, boolean success, double durationMs, long timestamp) {

    public AttemptRecord {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, was: " + attempt);
        }
        if (!Double.isFinite(durationMs) || durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be a non-negative number, was: " + durationMs);
        }
    }
}
