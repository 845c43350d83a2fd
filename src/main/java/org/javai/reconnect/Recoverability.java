package org.javai.reconnect;

/**
 * Qualitative estimate of whether reconnecting is likely to succeed at all.
 */
public enum Recoverability {
    /**
     * Reconnecting without user involvement is unlikely to work.
     */
    LOW,

    /**
     * Reconnecting might work.
     */
    MEDIUM,

    /**
     * The drop looks transient; reconnecting is expected to work.
     */
    HIGH
}
