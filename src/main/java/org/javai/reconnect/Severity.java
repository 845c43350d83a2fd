package org.javai.reconnect;

/**
 * How serious a disconnection is for the client experience.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
