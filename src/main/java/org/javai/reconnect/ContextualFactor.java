package org.javai.reconnect;

/**
 * Circumstances attached to a disconnect analysis that shape the retry schedule.
 */
public enum ContextualFactor {
    NETWORK_INSTABILITY("network_instability"),
    SERVER_MAINTENANCE("server_maintenance"),
    TRANSPORT_INSTABILITY("transport_instability"),
    AUTH_ISSUE("auth_issue"),
    RESOURCE_PRESSURE("resource_pressure"),
    MANUAL_DISCONNECT("manual_disconnect"),
    MOBILE_NETWORK("mobile_network");

    private final String key;

    ContextualFactor(String key) {
        this.key = key;
    }

    /**
     * Stable token used in logs and metrics.
     */
    public String key() {
        return key;
    }
}
