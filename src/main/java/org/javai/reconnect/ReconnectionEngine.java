package org.javai.reconnect;

import org.javai.reconnect.analysis.DefaultDisconnectClassifier;
import org.javai.reconnect.analysis.DisconnectAnalyzer;
import org.javai.reconnect.analysis.DisconnectClassifier;
import org.javai.reconnect.ops.CompositeReconnectionListener;
import org.javai.reconnect.ops.ReconnectionListener;
import org.javai.reconnect.schedule.ReconnectAttempt;
import org.javai.reconnect.schedule.ScheduleExecution;
import org.javai.reconnect.schedule.ScheduleExecutor;
import org.javai.reconnect.schedule.ScheduleGenerator;
import org.javai.reconnect.tracking.ClientStateStore;
import org.javai.reconnect.tracking.GlobalStatsAggregator;
import org.javai.reconnect.tracking.RecommendationEngine;
import org.javai.reconnect.tracking.RetentionSweeper;
import org.javai.reconnect.tracking.SuccessPredictor;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;

/**
 * Decides how disconnected clients should reconnect and learns from how their attempts went.
 *
 * <p>The transport layer reports a disconnection, receives a schedule, executes it, and reports
 * every attempt back through {@link #trackReconnectionAttempt}. Analysis and schedule generation
 * are stateless; tracking is safe for concurrent use across clients.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * ReconnectionEngine engine = ReconnectionEngine.builder()
 *     .config(ReconnectionConfig.fromSystemProperties())
 *     .listener(new Log4jReconnectionListener())
 *     .build();
 *
 * ReconnectionPlan plan = engine.plan(socketId, "ping timeout", history);
 * for (ScheduleEntry entry : plan.schedule()) {
 *     // wait entry.delay(), reconnect over entry.transport(), then:
 *     engine.trackReconnectionAttempt(socketId, entry.attempt(), connected, elapsedMs);
 * }
 * }</pre>
 */
public final class ReconnectionEngine {

    private final ReconnectionConfig config;
    private final Clock clock;
    private final DisconnectAnalyzer analyzer;
    private final ScheduleGenerator scheduleGenerator;
    private final GlobalStatsAggregator globalStats;
    private final ClientStateStore store;
    private final RecommendationEngine recommendations;
    private final SuccessPredictor predictor;
    private final RetentionSweeper sweeper;
    private final ScheduleExecutor executor;

    private ReconnectionEngine(
            ReconnectionConfig config,
            DisconnectClassifier classifier,
            ReconnectionListener listener,
            Clock clock,
            ScheduleExecutor.Sleeper sleeper
    ) {
        this.config = config;
        this.clock = clock;
        this.analyzer = new DisconnectAnalyzer(classifier, listener);
        this.scheduleGenerator = new ScheduleGenerator();
        this.globalStats = new GlobalStatsAggregator();
        this.store = new ClientStateStore(globalStats, listener, clock);
        this.recommendations = new RecommendationEngine(store);
        this.predictor = new SuccessPredictor(store);
        this.sweeper = new RetentionSweeper(store, clock, config.retention());
        this.executor = new ScheduleExecutor(store, clock, sleeper);
    }

    /**
     * Creates an engine with default configuration and no listener.
     */
    public static ReconnectionEngine create() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for configuring a ReconnectionEngine.
     */
    public static final class Builder {
        private ReconnectionConfig config = ReconnectionConfig.defaults();
        private DisconnectClassifier classifier = new DefaultDisconnectClassifier();
        private ReconnectionListener listener = ReconnectionListener.noOp();
        private Clock clock = Clock.systemUTC();
        private ScheduleExecutor.Sleeper sleeper = Thread::sleep;

        private Builder() {}

        /**
         * Sets the configuration (optional, defaults to {@link ReconnectionConfig#defaults()}).
         */
        public Builder config(ReconnectionConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        /**
         * Sets the disconnect classifier (optional, defaults to {@link DefaultDisconnectClassifier}).
         */
        public Builder classifier(DisconnectClassifier classifier) {
            this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
            return this;
        }

        /**
         * Sets the listener for reconnection events (optional, defaults to no-op).
         * A listener that throws is logged and does not affect the engine.
         */
        public Builder listener(ReconnectionListener listener) {
            this.listener = Objects.requireNonNull(listener, "listener must not be null");
            return this;
        }

        /**
         * Sets the clock used for attempt timestamps and retention (optional, defaults to UTC system clock).
         */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock must not be null");
            return this;
        }

        /**
         * Sets the sleeper for testing (package-private).
         */
        Builder sleeper(ScheduleExecutor.Sleeper sleeper) {
            this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
            return this;
        }

        public ReconnectionEngine build() {
            ReconnectionListener isolated = listener instanceof CompositeReconnectionListener
                    ? listener
                    : CompositeReconnectionListener.of(listener);
            return new ReconnectionEngine(config, classifier, isolated, clock, sleeper);
        }
    }

    // === ANALYSIS AND SCHEDULING ===

    /**
     * Classifies a disconnection and picks a retry strategy for it.
     *
     * @param clientId The disconnected client
     * @param reason The reason reported by the transport layer
     * @param history The client's connection history (null is treated as empty)
     */
    public DisconnectAnalysis analyze(String clientId, String reason, ConnectionHistory history) {
        return analyzer.analyze(clientId, reason, history);
    }

    /**
     * Generates a schedule using the configured base delay.
     */
    public List<ScheduleEntry> generateSchedule(DisconnectAnalysis analysis) {
        return generateSchedule(analysis, config.baseDelay());
    }

    public List<ScheduleEntry> generateSchedule(DisconnectAnalysis analysis, Duration baseDelay) {
        Objects.requireNonNull(baseDelay, "baseDelay must not be null");
        return scheduleGenerator.generate(analysis, baseDelay.toMillis());
    }

    /**
     * Analyzes a disconnection and generates its schedule in one step.
     */
    public ReconnectionPlan plan(String clientId, String reason, ConnectionHistory history) {
        DisconnectAnalysis analysis = analyze(clientId, reason, history);
        return new ReconnectionPlan(clientId, analysis, generateSchedule(analysis));
    }

    /**
     * Builds the guidance pushed to a disconnected client.
     */
    public ReconnectionGuidance guidanceFor(ReconnectionPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        double estimatedDelay = plan.schedule().isEmpty() ? 0 : plan.schedule().get(0).delayMs();
        List<String> tips = getReconnectionRecommendations(plan.clientId()).stream()
                .map(Recommendation::message)
                .toList();
        return new ReconnectionGuidance(
                plan.clientId(),
                plan.analysis().strategy(),
                estimatedDelay,
                plan.analysis().maxAttempts(),
                tips
        );
    }

    /**
     * Walks a plan's schedule, tracking every attempt, until one succeeds.
     * Blocks the calling thread for the scheduled delays.
     */
    public ScheduleExecution execute(ReconnectionPlan plan, ReconnectAttempt attempt) {
        Objects.requireNonNull(plan, "plan must not be null");
        return executor.execute(plan.clientId(), plan.schedule(), attempt);
    }

    // === TRACKING ===

    /**
     * Records the outcome of a reconnection attempt. Unknown clients are created on first use.
     *
     * @return The client's state after the attempt
     */
    public ClientReconnectionState trackReconnectionAttempt(String clientId, int attempt, boolean success, double durationMs) {
        return store.track(clientId, attempt, success, durationMs);
    }

    public Optional<ClientReconnectionState> clientState(String clientId) {
        return store.find(clientId);
    }

    public List<Recommendation> getReconnectionRecommendations(String clientId) {
        return recommendations.recommendationsFor(clientId);
    }

    public double predictReconnectionSuccess(String clientId, ReconnectionStrategy proposedStrategy) {
        return predictor.predict(clientId, proposedStrategy);
    }

    public GlobalReconnectionStats getGlobalStats() {
        return globalStats.snapshot(store.size(), clock.instant());
    }

    /**
     * Discards a client's state.
     *
     * @return true if the client had state
     */
    public boolean resetClientState(String clientId) {
        return store.reset(clientId);
    }

    /**
     * Evicts clients idle for longer than the retention window.
     *
     * @return identifiers of the evicted clients
     */
    public Set<String> cleanup() {
        return sweeper.sweep();
    }

    /**
     * Runs {@link #cleanup()} on the executor at the configured sweep interval.
     */
    public ScheduledFuture<?> scheduleCleanup(ScheduledExecutorService executor) {
        return sweeper.scheduleOn(executor, config.sweepInterval());
    }
}
