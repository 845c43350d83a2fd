package org.javai.reconnect.ops.metrics;

import org.javai.reconnect.AttemptRecord;
import org.javai.reconnect.AttemptTrackedEvent;
import org.javai.reconnect.ClientReconnectionState;
import org.javai.reconnect.ContextualFactor;
import org.javai.reconnect.DisconnectAnalysis;
import org.javai.reconnect.ops.ReconnectionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.stream.Collectors;

/**
 * Reports reconnection events as JSON-lines metrics via SLF4J.
 *
 * <p>Every event is one JSON object on one line, with a {@code metric} key built from the
 * configured namespace, suitable for metrics aggregation pipelines.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"attempt_tracked","timestamp":"2024-01-20T10:30:00Z","metric":"soundboard.reconnect.attempt","clientId":"abc",...}
 * }</pre>
 */
public class MetricsReconnectionListener implements ReconnectionListener {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.reconnect.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

	private final String namespace;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a listener with no namespace and the default logger.
	 */
	public MetricsReconnectionListener() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a listener with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to metric keys (may be null or empty)
	 */
	public MetricsReconnectionListener(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a listener with the specified namespace and custom logger name.
	 *
	 * @param namespace the namespace to prepend to metric keys (may be null or empty)
	 * @param loggerName the logger name
	 */
	public MetricsReconnectionListener(String namespace, String loggerName) {
		this(namespace, LoggerFactory.getLogger(loggerName), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsReconnectionListener(String namespace, Logger logger, Clock clock) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void onAttemptTracked(AttemptTrackedEvent event) {
		try {
			logger.info(buildAttemptJson(event));
		} catch (RuntimeException e) {
			logger.debug("Could not emit attempt metric for {}", event.clientId(), e);
		}
	}

	@Override
	public void onDisconnectAnalyzed(String clientId, DisconnectAnalysis analysis) {
		try {
			logger.info(buildAnalysisJson(clientId, analysis));
		} catch (RuntimeException e) {
			logger.debug("Could not emit analysis metric for {}", clientId, e);
		}
	}

	@Override
	public void onClientStateEvicted(String clientId, ClientReconnectionState state) {
		try {
			logger.info(buildEvictedJson(clientId, state));
		} catch (RuntimeException e) {
			logger.debug("Could not emit eviction metric for {}", clientId, e);
		}
	}

	@Override
	public void onClientStateReset(String clientId) {
		try {
			logger.info(buildResetJson(clientId));
		} catch (RuntimeException e) {
			logger.debug("Could not emit reset metric for {}", clientId, e);
		}
	}

	private String buildAttemptJson(AttemptTrackedEvent event) {
		AttemptRecord attempt = event.attempt();
		ClientReconnectionState state = event.state();
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "attempt_tracked", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(Instant.ofEpochMilli(attempt.timestamp())), false);
		appendField(sb, "metric", metricKey("reconnect.attempt"), false);
		appendField(sb, "clientId", event.clientId(), false);
		appendField(sb, "attempt", String.valueOf(attempt.attempt()), false);
		appendField(sb, "success", String.valueOf(attempt.success()), false);
		appendField(sb, "durationMs", String.valueOf(attempt.durationMs()), false);
		appendField(sb, "attempts", String.valueOf(state.attempts()), false);
		appendField(sb, "successes", String.valueOf(state.successes()), false);
		appendField(sb, "failures", String.valueOf(state.failures()), false);
		appendField(sb, "patternCount", String.valueOf(state.patterns().size()), false);
		sb.append("}");
		return sb.toString();
	}

	private String buildAnalysisJson(String clientId, DisconnectAnalysis analysis) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendField(sb, "eventType", "disconnect_analyzed", true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()), false);
		appendField(sb, "metric", metricKey("reconnect.analysis"), false);
		appendField(sb, "clientId", clientId, false);
		appendField(sb, "cause", analysis.cause().name(), false);
		appendField(sb, "severity", analysis.severity().name(), false);
		appendField(sb, "recoverability", analysis.recoverability().name(), false);
		appendField(sb, "strategy", analysis.strategy().name(), false);
		appendField(sb, "backoffMultiplier", String.valueOf(analysis.backoffMultiplier()), false);
		appendField(sb, "maxAttempts", String.valueOf(analysis.maxAttempts()), false);
		appendField(sb, "factors", analysis.contextualFactors().stream()
				.map(ContextualFactor::key)
				.collect(Collectors.joining(",")), false);
		sb.append("}");
		return sb.toString();
	}

	private String buildEvictedJson(String clientId, ClientReconnectionState state) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendLifecycleFields(sb, "client_evicted", "reconnect.evicted", clientId);
		appendField(sb, "attempts", String.valueOf(state.attempts()), false);
		sb.append("}");
		return sb.toString();
	}

	private String buildResetJson(String clientId) {
		StringBuilder sb = new StringBuilder();
		sb.append("{");
		appendLifecycleFields(sb, "client_reset", "reconnect.reset", clientId);
		sb.append("}");
		return sb.toString();
	}

	private void appendLifecycleFields(StringBuilder sb, String eventType, String metric, String clientId) {
		appendField(sb, "eventType", eventType, true);
		appendField(sb, "timestamp", ISO_FORMATTER.format(clock.instant()), false);
		appendField(sb, "metric", metricKey(metric), false);
		appendField(sb, "clientId", clientId, false);
	}

	String metricKey(String name) {
		if (namespace == null) {
			return name;
		}
		return namespace + "." + name;
	}

	private void appendField(StringBuilder sb, String key, String value, boolean first) {
		if (!first) {
			sb.append(",");
		}
		sb.append("\"").append(key).append("\":\"").append(escapeJson(value)).append("\"");
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}

	static String escapeJson(String s) {
		if (s == null) {
			return "";
		}
		StringBuilder sb = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '"' -> sb.append("\\\"");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> {
					if (c < 0x20) {
						sb.append(String.format("\\u%04x", (int) c));
					} else {
						sb.append(c);
					}
				}
			}
		}
		return sb.toString();
	}
}
