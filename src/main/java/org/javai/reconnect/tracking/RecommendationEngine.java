package org.javai.reconnect.tracking;

import org.javai.reconnect.ClientReconnectionState;
import org.javai.reconnect.Recommendation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives diagnostic advice from a client's reconnection history.
 * Read-only; never gates retries.
 */
public final class RecommendationEngine {

    static final int RECENT_WINDOW = 10;
    static final double LOW_SUCCESS_RATE = 0.3;
    static final double SLOW_ATTEMPT_MS = 10_000;

    private final ClientStateStore store;

    public RecommendationEngine(ClientStateStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
    }

    /**
     * Returns advice for a client, highest priority first, or an empty list for an unknown client.
     */
    public List<Recommendation> recommendationsFor(String clientId) {
        return store.find(clientId)
                .map(RecommendationEngine::recommend)
                .orElse(List.of());
    }

    static List<Recommendation> recommend(ClientReconnectionState state) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (state.successRate(RECENT_WINDOW) < LOW_SUCCESS_RATE) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.CONNECTION_METHOD,
                    "Consider switching connection method or checking network",
                    Recommendation.Priority.HIGH));
        }

        if (state.failures() > state.successes() * 2) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.BACKOFF_STRATEGY,
                    "Increase backoff delays to reduce connection pressure",
                    Recommendation.Priority.MEDIUM));
        }

        if (state.averageDurationMs() > SLOW_ATTEMPT_MS) {
            recommendations.add(new Recommendation(
                    Recommendation.Type.TIMEOUT_ADJUSTMENT,
                    "Connection timeouts may be too aggressive",
                    Recommendation.Priority.LOW));
        }

        return List.copyOf(recommendations);
    }
}
