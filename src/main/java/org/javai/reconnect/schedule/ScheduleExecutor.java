package org.javai.reconnect.schedule;

import org.javai.reconnect.ClientReconnectionState;
import org.javai.reconnect.ScheduleEntry;
import org.javai.reconnect.tracking.ClientStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Walks a reconnection schedule on behalf of the transport layer.
 *
 * <p>For each entry it waits the scheduled delay, runs the caller's {@link ReconnectAttempt},
 * times it and tracks the outcome. The walk stops at the first successful attempt. Connections
 * are never opened here; that is the attempt's job.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ReconnectionPlan plan = engine.plan(clientId, reason, history);
 * ScheduleExecution result = engine.execute(plan, entry -> socket.reconnect(entry.transport().wireName()));
 * }</pre>
 */
public final class ScheduleExecutor {

    private static final Logger LOG = LoggerFactory.getLogger(ScheduleExecutor.class);

    private final ClientStateStore store;
    private final Clock clock;
    private final Sleeper sleeper;

    public ScheduleExecutor(ClientStateStore store, Clock clock) {
        this(store, clock, Thread::sleep);
    }

    public ScheduleExecutor(ClientStateStore store, Clock clock, Sleeper sleeper) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
    }

    /**
     * Executes a schedule for a client.
     *
     * @param clientId The client being reconnected
     * @param schedule The attempts to make, in order
     * @param attempt The transport's reconnect operation
     * @return How the walk ended
     */
    public ScheduleExecution execute(String clientId, List<ScheduleEntry> schedule, ReconnectAttempt attempt) {
        Objects.requireNonNull(clientId, "clientId must not be null");
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(attempt, "attempt must not be null");

        if (schedule.isEmpty()) {
            return new ScheduleExecution(ScheduleExecution.Status.DECLINED, 0, store.find(clientId).orElse(null));
        }

        ClientReconnectionState state = null;
        int made = 0;
        for (ScheduleEntry entry : schedule) {
            try {
                sleep(entry);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new ScheduleExecution(ScheduleExecution.Status.INTERRUPTED, made, state);
            }

            long startedAt = clock.millis();
            boolean success = runAttempt(clientId, entry, attempt);
            long duration = Math.max(0, clock.millis() - startedAt);

            made++;
            state = store.track(clientId, entry.attempt(), success, duration);
            if (success) {
                return new ScheduleExecution(ScheduleExecution.Status.CONNECTED, made, state);
            }
            if (Thread.currentThread().isInterrupted()) {
                return new ScheduleExecution(ScheduleExecution.Status.INTERRUPTED, made, state);
            }
        }
        return new ScheduleExecution(ScheduleExecution.Status.EXHAUSTED, made, state);
    }

    private boolean runAttempt(String clientId, ScheduleEntry entry, ReconnectAttempt attempt) {
        try {
            return attempt.connect(entry);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (Exception e) {
            LOG.warn("Reconnect attempt {} for {} over {} failed", entry.attempt(), clientId,
                    entry.transport().wireName(), e);
            return false;
        }
    }

    private void sleep(ScheduleEntry entry) throws InterruptedException {
        long millis = entry.delay().toMillis();
        if (millis > 0) {
            sleeper.sleep(millis);
        }
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
