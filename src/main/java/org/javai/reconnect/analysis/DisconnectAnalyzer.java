package org.javai.reconnect.analysis;

import org.javai.reconnect.ConnectionHistory;
import org.javai.reconnect.DisconnectAnalysis;
import org.javai.reconnect.DisconnectCause;
import org.javai.reconnect.ops.ReconnectionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Turns a reported disconnection into a {@link DisconnectAnalysis}.
 *
 * <p>The pipeline is classify → assess → select → adjust for history. It holds no state
 * of its own and may be called concurrently.
 */
public final class DisconnectAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(DisconnectAnalyzer.class);

    private final DisconnectClassifier classifier;
    private final DisconnectAssessor assessor;
    private final StrategySelector selector;
    private final HistoryAdjuster adjuster;
    private final ReconnectionListener listener;

    public DisconnectAnalyzer(DisconnectClassifier classifier, ReconnectionListener listener) {
        this(classifier, new DisconnectAssessor(), new StrategySelector(), new HistoryAdjuster(), listener);
    }

    DisconnectAnalyzer(
            DisconnectClassifier classifier,
            DisconnectAssessor assessor,
            StrategySelector selector,
            HistoryAdjuster adjuster,
            ReconnectionListener listener
    ) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.assessor = Objects.requireNonNull(assessor, "assessor must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.adjuster = Objects.requireNonNull(adjuster, "adjuster must not be null");
        this.listener = Objects.requireNonNull(listener, "listener must not be null");
    }

    /**
     * Analyzes a disconnection.
     *
     * @param clientId The disconnected client
     * @param reason The reason reported by the transport layer (may be null)
     * @param history The client's connection history (null is treated as empty)
     * @return The analysis, never null
     */
    public DisconnectAnalysis analyze(String clientId, String reason, ConnectionHistory history) {
        Objects.requireNonNull(clientId, "clientId must not be null");
        ConnectionHistory effectiveHistory = history != null ? history : ConnectionHistory.empty();

        DisconnectCause cause = classifier.classify(reason);
        if (cause == null) {
            cause = DisconnectCause.UNKNOWN;
        }
        StrategySelection selection = adjuster.adjust(selector.select(cause), effectiveHistory);

        DisconnectAnalysis analysis = new DisconnectAnalysis(
                cause,
                assessor.severity(reason, effectiveHistory),
                assessor.recoverability(reason, effectiveHistory),
                selection.strategy(),
                selection.backoffMultiplier(),
                selection.maxAttempts(),
                selection.factors()
        );

        LOG.debug("Disconnection analysis for {}: cause={}, severity={}, strategy={}, maxAttempts={}",
                clientId, analysis.cause(), analysis.severity(), analysis.strategy(), analysis.maxAttempts());
        listener.onDisconnectAnalyzed(clientId, analysis);
        return analysis;
    }
}
