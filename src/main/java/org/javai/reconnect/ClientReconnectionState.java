package org.javai.reconnect;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rolling reconnection history for one client. Instances are immutable; every tracked
 * attempt produces a new state.
 *
 * @param attempts Total tracked attempts
 * @param successes Attempts that reconnected
 * @param failures Attempts that did not reconnect
 * @param totalDurationMs Sum of all attempt durations, in milliseconds
 * @param lastAttempt The most recent attempt (null only for a state that has tracked nothing)
 * @param patterns The most recent attempts, oldest first, at most {@link #MAX_PATTERNS}
 */
public record ClientReconnectionState(
        int attempts,
        int successes,
        int failures,
        double totalDurationMs,
        AttemptRecord lastAttempt,
        List<AttemptRecord> patterns
) {

    /**
     * Size of the pattern log. Older entries are evicted first.
     */
    public static final int MAX_PATTERNS = 20;

    public ClientReconnectionState {
        if (attempts != successes + failures) {
            throw new IllegalArgumentException("attempts must equal successes + failures: "
                    + attempts + " != " + successes + " + " + failures);
        }
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        if (patterns.size() > MAX_PATTERNS) {
            throw new IllegalArgumentException("patterns must hold at most " + MAX_PATTERNS + " entries");
        }
    }

    public static ClientReconnectionState empty() {
        return new ClientReconnectionState(0, 0, 0, 0, null, List.of());
    }

    /**
     * Returns the state after recording one more attempt.
     */
    public ClientReconnectionState record(AttemptRecord attempt) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        List<AttemptRecord> nextPatterns = new ArrayList<>(patterns.size() + 1);
        nextPatterns.addAll(patterns);
        nextPatterns.add(attempt);
        if (nextPatterns.size() > MAX_PATTERNS) {
            nextPatterns = nextPatterns.subList(nextPatterns.size() - MAX_PATTERNS, nextPatterns.size());
        }
        return new ClientReconnectionState(
                attempts + 1,
                attempt.success() ? successes + 1 : successes,
                attempt.success() ? failures : failures + 1,
                totalDurationMs + attempt.durationMs(),
                attempt,
                nextPatterns
        );
    }

    /**
     * The last {@code count} pattern entries, oldest first.
     */
    public List<AttemptRecord> recentPatterns(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0, was: " + count);
        }
        return patterns.subList(Math.max(0, patterns.size() - count), patterns.size());
    }

    /**
     * Fraction of the last {@code count} pattern entries that succeeded, or 0 when there are none.
     */
    public double successRate(int count) {
        List<AttemptRecord> recent = recentPatterns(count);
        if (recent.isEmpty()) {
            return 0;
        }
        long succeeded = recent.stream().filter(AttemptRecord::success).count();
        return (double) succeeded / recent.size();
    }

    public double averageDurationMs() {
        return attempts == 0 ? 0 : totalDurationMs / attempts;
    }

    /**
     * True when the last tracked attempt happened strictly before the cutoff.
     */
    public boolean idleSince(long cutoffMillis) {
        return lastAttempt != null && lastAttempt.timestamp() < cutoffMillis;
    }
}
