package org.javai.reconnect.analysis;

import org.javai.reconnect.ConnectionHistory;
import org.javai.reconnect.ContextualFactor;
import org.javai.reconnect.ReconnectionStrategy;

/**
 * Tunes a strategy selection using the client's connection history.
 *
 * <p>Three independent rules apply in order:
 * <ol>
 *   <li>more than 5 recent failures: multiplier × 1.5, two fewer attempts (at least 3)</li>
 *   <li>a connection held longer than 5 minutes: multiplier × 0.8, two more attempts</li>
 *   <li>a mobile network: multiplier × 1.3 and the {@code mobile_network} factor</li>
 * </ol>
 * A {@link ReconnectionStrategy#USER_PROMPT} selection only takes rule 3, so it keeps zero attempts.
 */
public class HistoryAdjuster {

    static final int MANY_RECENT_FAILURES = 5;
    static final long STABLE_CONNECTION_MS = 300_000;
    static final int MIN_ATTEMPTS_AFTER_FAILURES = 3;

    public StrategySelection adjust(StrategySelection selection, ConnectionHistory history) {
        StrategySelection adjusted = selection;
        boolean retries = selection.strategy() != ReconnectionStrategy.USER_PROMPT;

        if (retries && history.recentFailures() > MANY_RECENT_FAILURES) {
            adjusted = adjusted
                    .withMultiplier(adjusted.backoffMultiplier() * 1.5)
                    .withMaxAttempts(Math.max(MIN_ATTEMPTS_AFTER_FAILURES, adjusted.maxAttempts() - 2));
        }

        if (retries && history.longestConnectionMs() > STABLE_CONNECTION_MS) {
            adjusted = adjusted
                    .withMultiplier(adjusted.backoffMultiplier() * 0.8)
                    .withMaxAttempts(adjusted.maxAttempts() + 2);
        }

        if (history.onMobileNetwork()) {
            adjusted = adjusted
                    .withMultiplier(adjusted.backoffMultiplier() * 1.3)
                    .withFactor(ContextualFactor.MOBILE_NETWORK);
        }

        return adjusted;
    }
}
