package org.javai.reconnect.analysis;

import org.javai.reconnect.DisconnectCause;

/**
 * Maps a transport-level disconnect reason to a categorical cause.
 * Implementations must be total: an unrecognized reason yields {@link DisconnectCause#UNKNOWN}.
 */
@FunctionalInterface
public interface DisconnectClassifier {

    /**
     * Classifies a disconnect reason.
     *
     * @param reason The free-text reason reported by the transport layer (may be null)
     * @return The cause, never null
     */
    DisconnectCause classify(String reason);
}
