package org.javai.reconnect.analysis;

import org.javai.reconnect.DisconnectCause;

import java.util.List;
import java.util.Locale;

/**
 * Classifies the disconnect reasons emitted by the soundboard's real-time transport.
 *
 * <p>The reason is lower-cased and tested against an ordered keyword table. The first keyword
 * contained in the reason decides the cause, so the table order is part of the behavior.
 */
public class DefaultDisconnectClassifier implements DisconnectClassifier {

    private static final List<Rule> RULES = List.of(
            new Rule("ping timeout", DisconnectCause.NETWORK_TIMEOUT),
            new Rule("transport close", DisconnectCause.TRANSPORT_ERROR),
            new Rule("transport error", DisconnectCause.TRANSPORT_ERROR),
            new Rule("client namespace disconnect", DisconnectCause.USER_INITIATED),
            new Rule("io server disconnect", DisconnectCause.SERVER_SHUTDOWN),
            new Rule("connection timeout", DisconnectCause.NETWORK_TIMEOUT),
            new Rule("server error", DisconnectCause.SERVER_SHUTDOWN),
            new Rule("auth failed", DisconnectCause.AUTHENTICATION_FAILURE),
            new Rule("resource limit", DisconnectCause.RESOURCE_EXHAUSTION)
    );

    @Override
    public DisconnectCause classify(String reason) {
        if (reason == null || reason.isBlank()) {
            return DisconnectCause.UNKNOWN;
        }
        String lowerReason = reason.toLowerCase(Locale.ROOT);
        for (Rule rule : RULES) {
            if (lowerReason.contains(rule.keyword())) {
                return rule.cause();
            }
        }
        return DisconnectCause.UNKNOWN;
    }

    private record Rule(String keyword, DisconnectCause cause) {}
}
