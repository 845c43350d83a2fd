package org.javai.reconnect.analysis;

import org.javai.reconnect.ContextualFactor;
import org.javai.reconnect.DisconnectCause;
import org.javai.reconnect.ReconnectionStrategy;

import java.util.Objects;

/**
 * Picks the retry strategy and baseline parameters for a disconnect cause.
 */
public class StrategySelector {

    public StrategySelection select(DisconnectCause cause) {
        Objects.requireNonNull(cause, "cause must not be null");
        return switch (cause) {
            case NETWORK_TIMEOUT -> StrategySelection.of(
                    ReconnectionStrategy.EXPONENTIAL_BACKOFF, 1.5, 8, ContextualFactor.NETWORK_INSTABILITY);
            case SERVER_SHUTDOWN -> StrategySelection.of(
                    ReconnectionStrategy.LINEAR_BACKOFF, 2.0, 5, ContextualFactor.SERVER_MAINTENANCE);
            // quick retries on the other transport
            case TRANSPORT_ERROR -> StrategySelection.of(
                    ReconnectionStrategy.TRANSPORT_SWITCH, 0.5, 6, ContextualFactor.TRANSPORT_INSTABILITY);
            case AUTHENTICATION_FAILURE -> StrategySelection.of(
                    ReconnectionStrategy.USER_PROMPT, 0, 0, ContextualFactor.AUTH_ISSUE);
            case RESOURCE_EXHAUSTION -> StrategySelection.of(
                    ReconnectionStrategy.ADAPTIVE_TIMING, 3.0, 4, ContextualFactor.RESOURCE_PRESSURE);
            case USER_INITIATED -> StrategySelection.of(
                    ReconnectionStrategy.USER_PROMPT, 0, 0, ContextualFactor.MANUAL_DISCONNECT);
            case UNKNOWN -> StrategySelection.of(
                    ReconnectionStrategy.ADAPTIVE_TIMING, 1.2, 6, null);
        };
    }
}
