package org.javai.reconnect;

import java.time.Duration;
import java.util.Objects;

/**
 * Tunable settings of the reconnection engine.
 *
 * <p>{@link #fromSystemProperties()} resolves each setting from a system property, falling back
 * to an environment variable and then to the default:
 * <ul>
 *   <li>{@code reconnect.base.delay.ms} / {@code RECONNECT_BASE_DELAY_MS} - base schedule delay</li>
 *   <li>{@code reconnect.retention.hours} / {@code RECONNECT_RETENTION_HOURS} - idle client retention</li>
 *   <li>{@code reconnect.sweep.interval.minutes} / {@code RECONNECT_SWEEP_INTERVAL_MINUTES} - cleanup period</li>
 * </ul>
 *
 * @param baseDelay Base delay for generated schedules
 * @param retention How long an idle client's state is kept
 * @param sweepInterval How often scheduled cleanup runs
 */
public record ReconnectionConfig(Duration baseDelay, Duration retention, Duration sweepInterval) {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofMillis(1000);
    public static final Duration DEFAULT_RETENTION = Duration.ofHours(24);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofHours(1);

    public ReconnectionConfig {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        Objects.requireNonNull(retention, "retention must not be null");
        Objects.requireNonNull(sweepInterval, "sweepInterval must not be null");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        if (sweepInterval.isNegative() || sweepInterval.isZero()) {
            throw new IllegalArgumentException("sweepInterval must be positive");
        }
    }

    public static ReconnectionConfig defaults() {
        return new ReconnectionConfig(DEFAULT_BASE_DELAY, DEFAULT_RETENTION, DEFAULT_SWEEP_INTERVAL);
    }

    /**
     * Resolves configuration from system properties or environment variables.
     *
     * @throws IllegalStateException if a configured value is not a whole number
     */
    public static ReconnectionConfig fromSystemProperties() {
        return new ReconnectionConfig(
                Duration.ofMillis(resolveLong("reconnect.base.delay.ms", "RECONNECT_BASE_DELAY_MS",
                        DEFAULT_BASE_DELAY.toMillis())),
                Duration.ofHours(resolveLong("reconnect.retention.hours", "RECONNECT_RETENTION_HOURS",
                        DEFAULT_RETENTION.toHours())),
                Duration.ofMinutes(resolveLong("reconnect.sweep.interval.minutes", "RECONNECT_SWEEP_INTERVAL_MINUTES",
                        DEFAULT_SWEEP_INTERVAL.toMinutes()))
        );
    }

    public ReconnectionConfig withBaseDelay(Duration baseDelay) {
        return new ReconnectionConfig(baseDelay, retention, sweepInterval);
    }

    public ReconnectionConfig withRetention(Duration retention) {
        return new ReconnectionConfig(baseDelay, retention, sweepInterval);
    }

    static long resolveLong(String sysProp, String envVar, long defaultValue) {
        String value = System.getProperty(sysProp);
        if (value == null || value.isBlank()) {
            value = System.getenv(envVar);
        }
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Invalid configuration: system property '" + sysProp +
                    "' or environment variable '" + envVar + "' must be a whole number, was: " + value, e);
        }
    }
}
