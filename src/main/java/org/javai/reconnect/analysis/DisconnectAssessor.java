package org.javai.reconnect.analysis;

import org.javai.reconnect.ConnectionHistory;
import org.javai.reconnect.Recoverability;
import org.javai.reconnect.Severity;

/**
 * Derives severity and recoverability from the raw disconnect reason and the client's history.
 *
 * <p>Keyword checks run against the reason exactly as the transport reported it (case-sensitive).
 */
public class DisconnectAssessor {

    static final int SEVERE_RECENT_FAILURES = 3;

    /**
     * Rules apply in order and a later applicable rule overrides an earlier one:
     * "timeout"/"error" → HIGH, then "client"/"user" → LOW, then more than three
     * recent failures → HIGH.
     */
    public Severity severity(String reason, ConnectionHistory history) {
        String text = reason == null ? "" : reason;
        Severity severity = Severity.MEDIUM;

        if (text.contains("timeout") || text.contains("error")) {
            severity = Severity.HIGH;
        }
        if (text.contains("client") || text.contains("user")) {
            severity = Severity.LOW;
        }
        if (history.recentFailures() > SEVERE_RECENT_FAILURES) {
            severity = Severity.HIGH;
        }
        return severity;
    }

    /**
     * First matching rule wins.
     */
    public Recoverability recoverability(String reason, ConnectionHistory history) {
        String text = reason == null ? "" : reason;

        if (text.contains("auth") || text.contains("user")) {
            return Recoverability.LOW;
        }
        if (text.contains("server") && history.serverRestarts() > 0) {
            return Recoverability.MEDIUM;
        }
        if (text.contains("timeout") || text.contains("transport")) {
            return Recoverability.HIGH;
        }
        return Recoverability.MEDIUM;
    }
}
