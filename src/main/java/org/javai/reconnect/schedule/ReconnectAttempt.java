package org.javai.reconnect.schedule;

import org.javai.reconnect.ScheduleEntry;

/**
 * A single reconnection attempt performed by the transport layer.
 */
@FunctionalInterface
public interface ReconnectAttempt {

    /**
     * Tries to reconnect as described by the schedule entry.
     *
     * @param entry The scheduled attempt (attempt number and transport to use)
     * @return true if the client is connected again
     * @throws Exception if the attempt failed abnormally; this counts as a failed attempt
     */
    boolean connect(ScheduleEntry entry) throws Exception;
}
