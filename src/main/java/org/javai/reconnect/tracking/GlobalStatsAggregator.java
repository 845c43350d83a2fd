package org.javai.reconnect.tracking;

import org.javai.reconnect.GlobalReconnectionStats;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cross-client reconnection counters.
 *
 * <p>Updates are lock-free: each recorded attempt swaps in a new immutable set of totals, so
 * the counters and the smoothed average always change together.
 */
public final class GlobalStatsAggregator {

    private final AtomicReference<Totals> totals = new AtomicReference<>(Totals.ZERO);

    /**
     * Records one attempt. The smoothed average becomes {@code (average + durationMs) / 2}.
     */
    public void record(boolean success, double durationMs) {
        totals.updateAndGet(current -> current.plus(success, durationMs));
    }

    public GlobalReconnectionStats snapshot(int activeClients, Instant now) {
        Totals current = totals.get();
        return new GlobalReconnectionStats(
                current.attempts(),
                current.successes(),
                current.failures(),
                current.averageMs(),
                activeClients,
                now
        );
    }

    private record Totals(long attempts, long successes, long failures, double averageMs) {

        static final Totals ZERO = new Totals(0, 0, 0, 0);

        Totals plus(boolean success, double durationMs) {
            return new Totals(
                    attempts + 1,
                    success ? successes + 1 : successes,
                    success ? failures : failures + 1,
                    (averageMs + durationMs) / 2
            );
        }
    }
}
