package org.javai.reconnect.schedule;

import org.javai.reconnect.ClientReconnectionState;

import java.util.Objects;

/**
 * Result of walking a reconnection schedule.
 *
 * @param status Why the walk ended
 * @param attemptsMade Number of attempts that were made
 * @param state The client's state after the last tracked attempt (null if no attempt was made)
 */
public record ScheduleExecution(Status status, int attemptsMade, ClientReconnectionState state) {

    public ScheduleExecution {
        Objects.requireNonNull(status, "status must not be null");
    }

    public boolean connected() {
        return status == Status.CONNECTED;
    }

    public enum Status {
        /**
         * An attempt reconnected the client.
         */
        CONNECTED,

        /**
         * Every scheduled attempt failed.
         */
        EXHAUSTED,

        /**
         * The schedule was empty; the user has to act.
         */
        DECLINED,

        /**
         * The executing thread was interrupted while waiting.
         */
        INTERRUPTED
    }
}
