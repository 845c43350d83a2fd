package org.javai.reconnect.schedule;

import org.javai.reconnect.ContextualFactor;
import org.javai.reconnect.DisconnectAnalysis;
import org.javai.reconnect.ReconnectionStrategy;
import org.javai.reconnect.ScheduleEntry;
import org.javai.reconnect.TransportHint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expands a disconnect analysis into a concrete, ordered list of reconnection attempts.
 *
 * <p>The schedule always holds exactly {@code maxAttempts} entries numbered from 1. Exponential
 * and adaptive delays never exceed {@link #MAX_DELAY_MS}. A fresh list is built on every call.
 */
public class ScheduleGenerator {

    public static final double DEFAULT_BASE_DELAY_MS = 1000;
    public static final double MAX_DELAY_MS = 30_000;

    static final double IMMEDIATE_DELAY_MS = 100;
    static final double ADAPTIVE_BASE_DELAY_MS = 1000;
    static final double ADAPTIVE_GROWTH = 1.4;
    static final double TRANSPORT_SWITCH_GROWTH = 1.2;
    static final double DEFAULT_GROWTH = 1.5;

    private static final TransportHint[] ALTERNATING_TRANSPORTS = {TransportHint.WEBSOCKET, TransportHint.POLLING};

    public List<ScheduleEntry> generate(DisconnectAnalysis analysis) {
        return generate(analysis, DEFAULT_BASE_DELAY_MS);
    }

    /**
     * Generates the schedule for an analysis.
     *
     * @param analysis The analysis to expand
     * @param baseDelayMs The base delay in milliseconds
     * @return The attempts in order; empty when the analysis declines to retry
     * @throws IllegalArgumentException if the base delay is negative or not a number
     */
    public List<ScheduleEntry> generate(DisconnectAnalysis analysis, double baseDelayMs) {
        Objects.requireNonNull(analysis, "analysis must not be null");
        if (!Double.isFinite(baseDelayMs) || baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs must be a non-negative number, was: " + baseDelayMs);
        }
        if (analysis.strategy() == ReconnectionStrategy.USER_PROMPT) {
            return List.of();
        }

        List<ScheduleEntry> schedule = new ArrayList<>(analysis.maxAttempts());
        double multiplier = analysis.backoffMultiplier();
        double currentDelay = baseDelayMs;
        if (analysis.strategy() == ReconnectionStrategy.EXPONENTIAL_BACKOFF) {
            currentDelay = Math.min(currentDelay, MAX_DELAY_MS);
        }

        for (int attempt = 1; attempt <= analysis.maxAttempts(); attempt++) {
            switch (analysis.strategy()) {
                case IMMEDIATE_RETRY -> schedule.add(
                        new ScheduleEntry(attempt, IMMEDIATE_DELAY_MS, TransportHint.WEBSOCKET, false));
                case EXPONENTIAL_BACKOFF -> {
                    schedule.add(new ScheduleEntry(attempt, currentDelay, TransportHint.WEBSOCKET, false));
                    currentDelay = Math.min(currentDelay * multiplier, MAX_DELAY_MS);
                }
                case LINEAR_BACKOFF -> schedule.add(
                        new ScheduleEntry(attempt, baseDelayMs * attempt * multiplier, TransportHint.WEBSOCKET, false));
                case ADAPTIVE_TIMING -> schedule.add(
                        new ScheduleEntry(attempt, adaptiveDelay(attempt, analysis), TransportHint.WEBSOCKET, true));
                case TRANSPORT_SWITCH -> {
                    TransportHint transport = ALTERNATING_TRANSPORTS[attempt % ALTERNATING_TRANSPORTS.length];
                    schedule.add(new ScheduleEntry(attempt, currentDelay, transport, false));
                    currentDelay *= TRANSPORT_SWITCH_GROWTH;
                }
                default -> {
                    schedule.add(new ScheduleEntry(attempt, currentDelay, TransportHint.WEBSOCKET, false));
                    currentDelay *= DEFAULT_GROWTH;
                }
            }
        }
        return schedule;
    }

    /**
     * Delay for an adaptive attempt: a base scaled by the analysis' contextual factors,
     * grown by 1.4 per attempt and capped at {@link #MAX_DELAY_MS}.
     */
    static double adaptiveDelay(int attempt, DisconnectAnalysis analysis) {
        double base = ADAPTIVE_BASE_DELAY_MS;
        if (analysis.hasFactor(ContextualFactor.NETWORK_INSTABILITY)) {
            base *= 2;
        }
        if (analysis.hasFactor(ContextualFactor.RESOURCE_PRESSURE)) {
            base *= 3;
        }
        if (analysis.hasFactor(ContextualFactor.MOBILE_NETWORK)) {
            base *= 1.5;
        }
        return Math.min(base * Math.pow(ADAPTIVE_GROWTH, attempt - 1), MAX_DELAY_MS);
    }
}
