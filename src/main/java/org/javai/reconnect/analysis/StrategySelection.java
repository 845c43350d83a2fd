package org.javai.reconnect.analysis;

import org.javai.reconnect.ContextualFactor;
import org.javai.reconnect.ReconnectionStrategy;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A retry strategy with its baseline parameters, before or after history adjustment.
 *
 * @param strategy The retry policy
 * @param backoffMultiplier Delay multiplier
 * @param maxAttempts Number of attempts
 * @param factors Contextual factors attached so far
 */
public record StrategySelection(
        ReconnectionStrategy strategy,
        double backoffMultiplier,
        int maxAttempts,
        Set<ContextualFactor> factors
) {

    public StrategySelection {
        Objects.requireNonNull(strategy, "strategy must not be null");
        EnumSet<ContextualFactor> copy = EnumSet.noneOf(ContextualFactor.class);
        if (factors != null) {
            copy.addAll(factors);
        }
        factors = Collections.unmodifiableSet(copy);
    }

    static StrategySelection of(ReconnectionStrategy strategy, double backoffMultiplier, int maxAttempts,
                                ContextualFactor factor) {
        Set<ContextualFactor> factors = factor == null ? Set.of() : Set.of(factor);
        return new StrategySelection(strategy, backoffMultiplier, maxAttempts, factors);
    }

    StrategySelection withMultiplier(double multiplier) {
        return new StrategySelection(strategy, multiplier, maxAttempts, factors);
    }

    StrategySelection withMaxAttempts(int attempts) {
        return new StrategySelection(strategy, backoffMultiplier, attempts, factors);
    }

    StrategySelection withFactor(ContextualFactor factor) {
        EnumSet<ContextualFactor> next = EnumSet.noneOf(ContextualFactor.class);
        next.addAll(factors);
        next.add(factor);
        return new StrategySelection(strategy, backoffMultiplier, maxAttempts, next);
    }
}
