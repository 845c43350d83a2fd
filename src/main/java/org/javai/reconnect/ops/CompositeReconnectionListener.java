package org.javai.reconnect.ops;

import org.javai.reconnect.AttemptTrackedEvent;
import org.javai.reconnect.ClientReconnectionState;
import org.javai.reconnect.DisconnectAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * A {@link ReconnectionListener} that delegates to multiple listeners.
 *
 * <p>All configured listeners receive every event. If a listener throws, the exception is
 * logged and the remaining listeners still run.
 *
 * <p>Example usage:
 * <pre>{@code
 * ReconnectionListener listener = CompositeReconnectionListener.builder()
 *     .add(new Log4jReconnectionListener())
 *     .addIf(metricsEnabled, new MetricsReconnectionListener("soundboard"))
 *     .build();
 * }</pre>
 */
public final class CompositeReconnectionListener implements ReconnectionListener {

	private static final Logger LOG = LoggerFactory.getLogger(CompositeReconnectionListener.class);

	private final List<ReconnectionListener> listeners;

	private CompositeReconnectionListener(List<ReconnectionListener> listeners) {
		this.listeners = List.copyOf(listeners);
	}

	/**
	 * Creates a composite listener from the given listeners.
	 *
	 * @param listeners the listeners to delegate to
	 * @return a composite that fans out to all given listeners
	 */
	public static CompositeReconnectionListener of(ReconnectionListener... listeners) {
		return new CompositeReconnectionListener(Arrays.asList(listeners));
	}

	/**
	 * Creates a composite listener from a collection of listeners.
	 *
	 * @param listeners the listeners to delegate to
	 * @return a composite that fans out to all given listeners
	 */
	public static CompositeReconnectionListener of(Collection<? extends ReconnectionListener> listeners) {
		return new CompositeReconnectionListener(new ArrayList<>(listeners));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void onAttemptTracked(AttemptTrackedEvent event) {
		fanOut("onAttemptTracked", listener -> listener.onAttemptTracked(event));
	}

	@Override
	public void onDisconnectAnalyzed(String clientId, DisconnectAnalysis analysis) {
		fanOut("onDisconnectAnalyzed", listener -> listener.onDisconnectAnalyzed(clientId, analysis));
	}

	@Override
	public void onClientStateEvicted(String clientId, ClientReconnectionState state) {
		fanOut("onClientStateEvicted", listener -> listener.onClientStateEvicted(clientId, state));
	}

	@Override
	public void onClientStateReset(String clientId) {
		fanOut("onClientStateReset", listener -> listener.onClientStateReset(clientId));
	}

	/**
	 * Returns the number of listeners in this composite.
	 */
	public int size() {
		return listeners.size();
	}

	private void fanOut(String method, Consumer<ReconnectionListener> call) {
		for (ReconnectionListener listener : listeners) {
			try {
				call.accept(listener);
			} catch (RuntimeException e) {
				LOG.warn("ReconnectionListener.{} failed for {}", method, listener.getClass().getName(), e);
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeReconnectionListener}.
	 */
	public static final class Builder {
		private final List<ReconnectionListener> listeners = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a listener to the composite. Null is ignored.
		 *
		 * @param listener the listener to add
		 * @return this builder
		 */
		public Builder add(ReconnectionListener listener) {
			if (listener != null) {
				listeners.add(listener);
			}
			return this;
		}

		public Builder addAll(Collection<? extends ReconnectionListener> listeners) {
			for (ReconnectionListener listener : listeners) {
				add(listener);
			}
			return this;
		}

		/**
		 * Conditionally adds a listener based on a flag.
		 *
		 * @param condition if true, the listener is added
		 * @param listener the listener to add
		 * @return this builder
		 */
		public Builder addIf(boolean condition, ReconnectionListener listener) {
			if (condition) {
				add(listener);
			}
			return this;
		}

		public CompositeReconnectionListener build() {
			return new CompositeReconnectionListener(listeners);
		}
	}
}
