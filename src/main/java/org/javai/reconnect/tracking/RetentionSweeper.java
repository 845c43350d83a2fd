package org.javai.reconnect.tracking;

import org.javai.reconnect.ClientReconnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Evicts client state that has not been touched within the retention window.
 *
 * <p>Sweeping is idempotent and can run at any time. An evicted client starts from
 * an empty state on its next tracked attempt.
 */
public final class RetentionSweeper {

    private static final Logger LOG = LoggerFactory.getLogger(RetentionSweeper.class);

    private final ClientStateStore store;
    private final Clock clock;
    private final Duration retention;

    public RetentionSweeper(ClientStateStore store, Clock clock, Duration retention) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.retention = Objects.requireNonNull(retention, "retention must not be null");
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive");
        }
    }

    /**
     * Removes every client whose last attempt is older than the retention window.
     *
     * @return identifiers of the evicted clients
     */
    public Set<String> sweep() {
        long cutoff = clock.millis() - retention.toMillis();
        Map<String, ClientReconnectionState> evicted = store.evictIdleBefore(cutoff);
        if (!evicted.isEmpty()) {
            LOG.info("Cleaned up reconnection state for {} idle client(s)", evicted.size());
        }
        return Set.copyOf(evicted.keySet());
    }

    /**
     * Runs {@link #sweep()} periodically on the given executor.
     *
     * @param executor The executor to run on
     * @param interval Time between sweeps
     * @return The scheduled task; cancel it to stop sweeping
     */
    public ScheduledFuture<?> scheduleOn(ScheduledExecutorService executor, Duration interval) {
        Objects.requireNonNull(executor, "executor must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        long millis = interval.toMillis();
        if (millis <= 0) {
            throw new IllegalArgumentException("interval must be positive");
        }
        return executor.scheduleAtFixedRate(this::sweepQuietly, millis, millis, TimeUnit.MILLISECONDS);
    }

    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // a failed run must not cancel the periodic task
            LOG.error("Reconnection state sweep failed", e);
        }
    }
}
