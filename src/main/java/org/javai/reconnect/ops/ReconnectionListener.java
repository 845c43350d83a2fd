package org.javai.reconnect.ops;

import org.javai.reconnect.AttemptTrackedEvent;
import org.javai.reconnect.ClientReconnectionState;
import org.javai.reconnect.DisconnectAnalysis;

/**
 * Receives reconnection events for observability.
 * Implementations might emit metrics, structured logs, or push guidance to clients.
 */
public interface ReconnectionListener {

	/**
	 * Called after every tracked reconnection attempt.
	 */
	void onAttemptTracked(AttemptTrackedEvent event);

	/**
	 * Called after a disconnection has been analyzed.
	 *
	 * @param clientId The disconnected client
	 * @param analysis The engine's decision
	 */
	default void onDisconnectAnalyzed(String clientId, DisconnectAnalysis analysis) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Called when an idle client's state is removed by the retention sweep.
	 *
	 * @param clientId The evicted client
	 * @param state The state that was discarded
	 */
	default void onClientStateEvicted(String clientId, ClientReconnectionState state) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * Called when a client's state is explicitly reset.
	 *
	 * @param clientId The client whose state was discarded
	 */
	default void onClientStateReset(String clientId) {
		// Default: no-op. Implementations may override.
	}

	/**
	 * A listener that does nothing. Useful for testing.
	 */
	static ReconnectionListener noOp() {
		return event -> {};
	}

	/**
	 * Creates a composite listener that fans out to all given listeners.
	 *
	 * @param listeners the listeners to delegate to
	 * @return a composite listener
	 */
	static ReconnectionListener composite(ReconnectionListener... listeners) {
		return CompositeReconnectionListener.of(listeners);
	}
}
