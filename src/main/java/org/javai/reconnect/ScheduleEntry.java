package org.javai.reconnect;

import java.time.Duration;
import java.util.Objects;

/**
 * One planned reconnection attempt.
 *
 * @param attempt The attempt number (1-based)
 * @param delayMs Delay before the attempt, in milliseconds
 * @param transport Transport to use for the attempt
 * @param adaptive Whether the delay was derived by adaptive timing
 */
public record ScheduleEntry(int attempt, double delayMs, TransportHint transport, boolean adaptive) {

    public ScheduleEntry {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1, was: " + attempt);
        }
        if (!(delayMs >= 0)) {
            throw new IllegalArgumentException("delayMs must be >= 0, was: " + delayMs);
        }
        Objects.requireNonNull(transport, "transport must not be null");
    }

    /**
     * The delay rounded to whole milliseconds.
     */
    public Duration delay() {
        return Duration.ofMillis(Math.round(delayMs));
    }
}
