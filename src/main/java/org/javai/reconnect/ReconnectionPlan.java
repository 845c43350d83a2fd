package org.javai.reconnect;

import java.util.List;
import java.util.Objects;

/**
 * An analysis together with the schedule generated from it.
 *
 * @param clientId The disconnected client
 * @param analysis Why the client dropped and how to retry
 * @param schedule The attempts to make, in order; empty when the user has to act
 */
public record ReconnectionPlan(String clientId, DisconnectAnalysis analysis, List<ScheduleEntry> schedule) {

    public ReconnectionPlan {
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(analysis, "analysis must not be null");
        schedule = schedule == null ? List.of() : List.copyOf(schedule);
    }

    public boolean autoRetry() {
        return !schedule.isEmpty();
    }
}
