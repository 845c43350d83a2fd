package org.javai.reconnect;

/**
 * Snapshot of a client's recent connection history, supplied by the transport layer.
 * The engine reads it but never changes it.
 *
 * @param recentFailures Number of recent failed connections
 * @param longestConnectionMs Longest connection the client held, in milliseconds
 * @param serverRestarts Number of server restarts the client has observed
 * @param networkType Network the client is on (e.g., "wifi", "mobile"); never null
 */
public record ConnectionHistory(
        int recentFailures,
        long longestConnectionMs,
        int serverRestarts,
        String networkType
) {

    public static final String UNKNOWN_NETWORK = "unknown";

    public ConnectionHistory {
        if (recentFailures < 0) {
            throw new IllegalArgumentException("recentFailures must be >= 0, was: " + recentFailures);
        }
        if (longestConnectionMs < 0) {
            throw new IllegalArgumentException("longestConnectionMs must be >= 0, was: " + longestConnectionMs);
        }
        if (serverRestarts < 0) {
            throw new IllegalArgumentException("serverRestarts must be >= 0, was: " + serverRestarts);
        }
        networkType = networkType == null || networkType.isBlank() ? UNKNOWN_NETWORK : networkType;
    }

    /**
     * History for a client the transport layer knows nothing about.
     */
    public static ConnectionHistory empty() {
        return new ConnectionHistory(0, 0, 0, UNKNOWN_NETWORK);
    }

    public boolean onMobileNetwork() {
        return "mobile".equals(networkType);
    }
}
