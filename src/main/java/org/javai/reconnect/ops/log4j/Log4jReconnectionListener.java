package org.javai.reconnect.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.reconnect.AttemptRecord;
import org.javai.reconnect.AttemptTrackedEvent;
import org.javai.reconnect.ClientReconnectionState;
import org.javai.reconnect.ContextualFactor;
import org.javai.reconnect.DisconnectAnalysis;
import org.javai.reconnect.Severity;
import org.javai.reconnect.ops.ReconnectionListener;

import java.util.stream.Collectors;

/**
 * Logs reconnection events using Log4j2.
 *
 * <p>Disconnect analyses are logged at a level derived from their {@link Severity}:
 * <ul>
 *   <li>{@code HIGH} → WARN</li>
 *   <li>{@code MEDIUM} → INFO</li>
 *   <li>{@code LOW} → DEBUG</li>
 * </ul>
 * Failed attempts are logged at WARN, successful ones at INFO. Each event type carries its own
 * marker so appenders can route them separately.
 */
public class Log4jReconnectionListener implements ReconnectionListener {

	private static final Marker ANALYSIS_MARKER = MarkerManager.getMarker("RECONNECT_ANALYSIS");
	private static final Marker ATTEMPT_MARKER = MarkerManager.getMarker("RECONNECT_ATTEMPT");
	private static final Marker EVICTED_MARKER = MarkerManager.getMarker("RECONNECT_EVICTED");
	private static final Marker RESET_MARKER = MarkerManager.getMarker("RECONNECT_RESET");

	private final Logger logger;

	/**
	 * Creates a listener using the default logger name.
	 */
	public Log4jReconnectionListener() {
		this(LogManager.getLogger("org.javai.reconnect.Reconnection"));
	}

	/**
	 * Creates a listener with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jReconnectionListener(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a listener with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jReconnectionListener(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void onDisconnectAnalyzed(String clientId, DisconnectAnalysis analysis) {
		logger.atLevel(levelFor(analysis.severity()))
			.withMarker(ANALYSIS_MARKER)
			.log("Disconnection analysis for [{}]: cause={}, severity={}, recoverability={}, strategy={}, maxAttempts={}, factors={}",
				clientId,
				analysis.cause(),
				analysis.severity(),
				analysis.recoverability(),
				analysis.strategy(),
				analysis.maxAttempts(),
				formatFactors(analysis));
	}

	@Override
	public void onAttemptTracked(AttemptTrackedEvent event) {
		AttemptRecord attempt = event.attempt();
		ClientReconnectionState state = event.state();
		logger.atLevel(attempt.success() ? Level.INFO : Level.WARN)
			.withMarker(ATTEMPT_MARKER)
			.log("Reconnection tracked for [{}]: attempt {}, success: {}, duration: {}ms ({} of {} attempts succeeded)",
				event.clientId(),
				attempt.attempt(),
				attempt.success(),
				attempt.durationMs(),
				state.successes(),
				state.attempts());
	}

	@Override
	public void onClientStateEvicted(String clientId, ClientReconnectionState state) {
		logger.atInfo()
			.withMarker(EVICTED_MARKER)
			.log("Cleaned up idle reconnection state for [{}] after {} attempts", clientId, state.attempts());
	}

	@Override
	public void onClientStateReset(String clientId) {
		logger.atInfo()
			.withMarker(RESET_MARKER)
			.log("Reset reconnection state for [{}]", clientId);
	}

	private static String formatFactors(DisconnectAnalysis analysis) {
		return analysis.contextualFactors().stream()
			.map(ContextualFactor::key)
			.collect(Collectors.joining(",", "[", "]"));
	}

	private static Level levelFor(Severity severity) {
		return switch (severity) {
			case HIGH -> Level.WARN;
			case MEDIUM -> Level.INFO;
			case LOW -> Level.DEBUG;
		};
	}
}
