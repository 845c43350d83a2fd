package org.javai.reconnect;

/**
 * Named retry policy controlling the shape of a reconnection schedule.
 */
public enum ReconnectionStrategy {
    /**
     * Fixed short delay on the websocket transport.
     */
    IMMEDIATE_RETRY,

    /**
     * Delay grows by the backoff multiplier after every attempt, capped at 30 seconds.
     */
    EXPONENTIAL_BACKOFF,

    /**
     * Delay grows linearly with the attempt number.
     */
    LINEAR_BACKOFF,

    /**
     * Delay derived from the contextual factors of the disconnection.
     */
    ADAPTIVE_TIMING,

    /**
     * Alternates between transports on every attempt.
     */
    TRANSPORT_SWITCH,

    /**
     * Do not retry automatically; the user has to act.
     */
    USER_PROMPT
}
