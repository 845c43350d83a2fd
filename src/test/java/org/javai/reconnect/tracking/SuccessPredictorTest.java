package org.javai.reconnect.tracking;

import org.javai.reconnect.MutableClock;
import org.javai.reconnect.ReconnectionStrategy;
import org.javai.reconnect.ops.ReconnectionListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class SuccessPredictorTest {

    private ClientStateStore store;
    private SuccessPredictor predictor;

    @BeforeEach
    void setUp() {
        store = new ClientStateStore(new GlobalStatsAggregator(), ReconnectionListener.noOp(),
                new MutableClock(Instant.parse("2024-01-20T10:30:00Z")));
        predictor = new SuccessPredictor(store);
    }

    @Test
    void unknownClient_usesDefaultProbability() {
        assertThat(predictor.predict("missing", ReconnectionStrategy.IMMEDIATE_RETRY)).isEqualTo(0.7);
    }

    @Test
    void fewerThanThreePatterns_usesDefaultProbability() {
        store.track("socket-1", 1, false, 100);
        store.track("socket-1", 2, false, 100);

        assertThat(predictor.predict("socket-1", ReconnectionStrategy.ADAPTIVE_TIMING)).isEqualTo(0.7);
    }

    @Test
    void scalesRecentSuccessRateByStrategy() {
        // last five: S F S F F
        store.track("socket-1", 1, true, 100);
        store.track("socket-1", 2, true, 100);
        store.track("socket-1", 3, false, 100);
        store.track("socket-1", 4, true, 100);
        store.track("socket-1", 5, false, 100);
        store.track("socket-1", 6, false, 100);

        assertThat(predictor.predict("socket-1", ReconnectionStrategy.IMMEDIATE_RETRY)).isCloseTo(0.32, within(1e-9));
        assertThat(predictor.predict("socket-1", ReconnectionStrategy.EXPONENTIAL_BACKOFF)).isCloseTo(0.48, within(1e-9));
        assertThat(predictor.predict("socket-1", ReconnectionStrategy.LINEAR_BACKOFF)).isCloseTo(0.4, within(1e-9));
    }

    @Test
    void clampsToOne() {
        for (int i = 1; i <= 5; i++) {
            store.track("socket-1", i, true, 100);
        }

        assertThat(predictor.predict("socket-1", ReconnectionStrategy.ADAPTIVE_TIMING)).isEqualTo(1.0);
    }

    @Test
    void allFailures_predictZero() {
        for (int i = 1; i <= 4; i++) {
            store.track("socket-1", i, false, 100);
        }

        assertThat(predictor.predict("socket-1", ReconnectionStrategy.TRANSPORT_SWITCH)).isZero();
    }

    @Test
    void strategyFactor_table() {
        assertThat(SuccessPredictor.strategyFactor(ReconnectionStrategy.IMMEDIATE_RETRY)).isEqualTo(0.8);
        assertThat(SuccessPredictor.strategyFactor(ReconnectionStrategy.EXPONENTIAL_BACKOFF)).isEqualTo(1.2);
        assertThat(SuccessPredictor.strategyFactor(ReconnectionStrategy.TRANSPORT_SWITCH)).isEqualTo(1.1);
        assertThat(SuccessPredictor.strategyFactor(ReconnectionStrategy.ADAPTIVE_TIMING)).isEqualTo(1.3);
        assertThat(SuccessPredictor.strategyFactor(ReconnectionStrategy.LINEAR_BACKOFF)).isEqualTo(1.0);
        assertThat(SuccessPredictor.strategyFactor(ReconnectionStrategy.USER_PROMPT)).isEqualTo(1.0);
        assertThat(SuccessPredictor.strategyFactor(null)).isEqualTo(1.0);
    }
}
