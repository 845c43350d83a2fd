package org.javai.reconnect.tracking;

import org.javai.reconnect.AttemptRecord;
import org.javai.reconnect.AttemptTrackedEvent;
import org.javai.reconnect.ClientReconnectionState;
import org.javai.reconnect.ops.ReconnectionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-client reconnection history, keyed by client identifier.
 *
 * <p>Each read-modify-write on a client's entry is atomic for that key, so concurrent
 * updates to the same client are serialized while different clients never block each other.
 * State is created on the first tracked attempt and only removed by {@link #reset(String)} or
 * {@link #evictIdleBefore(long)}.
 */
public final class ClientStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(ClientStateStore.class);

    private final ConcurrentMap<String, ClientReconnectionState> states = new ConcurrentHashMap<>();
    private final GlobalStatsAggregator globalStats;
    private final ReconnectionListener listener;
    private final Clock clock;

    public ClientStateStore(GlobalStatsAggregator globalStats, ReconnectionListener listener, Clock clock) {
        this.globalStats = Objects.requireNonNull(globalStats, "globalStats must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Records a reconnection attempt, creating the client's state if needed.
     *
     * @param clientId The client identifier
     * @param attempt The attempt number within its schedule
     * @param success Whether the client reconnected
     * @param durationMs How long the attempt took, in milliseconds
     * @return The client's state after the attempt
     */
    public ClientReconnectionState track(String clientId, int attempt, boolean success, double durationMs) {
        Objects.requireNonNull(clientId, "clientId must not be null");
        AttemptRecord record = new AttemptRecord(attempt, success, durationMs, clock.millis());

        ClientReconnectionState updated = states.compute(clientId, (id, current) -> {
            ClientReconnectionState base = current != null ? current : ClientReconnectionState.empty();
            globalStats.record(success, durationMs);
            return base.record(record);
        });

        LOG.trace("Reconnection tracked for {}: attempt {}, success: {}, duration: {}ms",
                clientId, attempt, success, durationMs);
        listener.onAttemptTracked(new AttemptTrackedEvent(clientId, record, updated));
        return updated;
    }

    public Optional<ClientReconnectionState> find(String clientId) {
        Objects.requireNonNull(clientId, "clientId must not be null");
        return Optional.ofNullable(states.get(clientId));
    }

    /**
     * Discards a client's state.
     *
     * @return true if the client had state
     */
    public boolean reset(String clientId) {
        Objects.requireNonNull(clientId, "clientId must not be null");
        boolean removed = states.remove(clientId) != null;
        if (removed) {
            LOG.info("Reset reconnection state for {}", clientId);
            listener.onClientStateReset(clientId);
        }
        return removed;
    }

    /**
     * Removes every client whose last attempt happened before the cutoff. Each removal
     * re-checks the entry atomically, so a client tracked concurrently is kept.
     *
     * @param cutoffMillis Epoch milliseconds; older clients are removed
     * @return The removed clients and the state they had
     */
    public Map<String, ClientReconnectionState> evictIdleBefore(long cutoffMillis) {
        Map<String, ClientReconnectionState> evicted = new LinkedHashMap<>();
        for (String clientId : states.keySet()) {
            states.computeIfPresent(clientId, (id, state) -> {
                if (state.idleSince(cutoffMillis)) {
                    evicted.put(id, state);
                    return null;
                }
                return state;
            });
        }
        evicted.forEach(listener::onClientStateEvicted);
        return evicted;
    }

    public int size() {
        return states.size();
    }
}
