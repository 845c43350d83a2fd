package org.javai.reconnect.tracking;

import org.javai.reconnect.ClientReconnectionState;
import org.javai.reconnect.ReconnectionStrategy;

import java.util.Objects;

/**
 * Estimates how likely a reconnection strategy is to succeed for a client.
 */
public final class SuccessPredictor {

    /**
     * Returned when a client has fewer than {@link #MIN_PATTERNS} tracked attempts.
     */
    public static final double DEFAULT_PROBABILITY = 0.7;

    static final int MIN_PATTERNS = 3;
    static final int RECENT_WINDOW = 5;

    private final ClientStateStore store;

    public SuccessPredictor(ClientStateStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Success rate of the client's last five attempts scaled by a strategy factor, in [0, 1].
     */
    public double predict(String clientId, ReconnectionStrategy proposedStrategy) {
        ClientReconnectionState state = store.find(clientId).orElse(null);
        if (state == null || state.patterns().size() < MIN_PATTERNS) {
            return DEFAULT_PROBABILITY;
        }
        double probability = state.successRate(RECENT_WINDOW) * strategyFactor(proposedStrategy);
        return Math.max(0.0, Math.min(1.0, probability));
    }

    static double strategyFactor(ReconnectionStrategy strategy) {
        if (strategy == null) {
            return 1.0;
        }
        return switch (strategy) {
            case IMMEDIATE_RETRY -> 0.8;
            case EXPONENTIAL_BACKOFF -> 1.2;
            case TRANSPORT_SWITCH -> 1.1;
            case ADAPTIVE_TIMING -> 1.3;
            default -> 1.0;
        };
    }
}
