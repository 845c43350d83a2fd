package org.javai.reconnect;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * The engine's decision about a single disconnection: why it happened and how to retry.
 *
 * @param cause The categorical cause of the drop
 * @param severity How serious the drop is
 * @param recoverability How likely a reconnect is to succeed
 * @param strategy The retry policy to apply
 * @param backoffMultiplier Delay multiplier used by the schedule
 * @param maxAttempts Number of scheduled attempts; 0 means do not retry automatically
 * @param contextualFactors Circumstances that shaped the decision
 */
public record DisconnectAnalysis(
        DisconnectCause cause,
        Severity severity,
        Recoverability recoverability,
        ReconnectionStrategy strategy,
        double backoffMultiplier,
        int maxAttempts,
        Set<ContextualFactor> contextualFactors
) {

    public DisconnectAnalysis {
        Objects.requireNonNull(cause, "cause must not be null");
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(recoverability, "recoverability must not be null");
        Objects.requireNonNull(strategy, "strategy must not be null");
        if (!Double.isFinite(backoffMultiplier) || backoffMultiplier < 0) {
            throw new IllegalArgumentException("backoffMultiplier must be a non-negative number, was: " + backoffMultiplier);
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0, was: " + maxAttempts);
        }
        EnumSet<ContextualFactor> factors = EnumSet.noneOf(ContextualFactor.class);
        if (contextualFactors != null) {
            factors.addAll(contextualFactors);
        }
        contextualFactors = Collections.unmodifiableSet(factors);
    }

    public boolean hasFactor(ContextualFactor factor) {
        return contextualFactors.contains(factor);
    }

    /**
     * True when the engine declines to retry and the user has to act.
     */
    public boolean requiresUserAction() {
        return strategy == ReconnectionStrategy.USER_PROMPT || maxAttempts == 0;
    }
}
