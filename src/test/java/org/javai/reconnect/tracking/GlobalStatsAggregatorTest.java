package org.javai.reconnect.tracking;

import org.javai.reconnect.GlobalReconnectionStats;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class GlobalStatsAggregatorTest {

    private static final Instant NOW = Instant.parse("2024-01-20T10:30:00Z");

    @Test
    void snapshot_beforeAnyAttempt_isZero() {
        GlobalReconnectionStats stats = new GlobalStatsAggregator().snapshot(0, NOW);

        assertThat(stats.totalAttempts()).isZero();
        assertThat(stats.averageReconnectionTimeMs()).isZero();
        assertThat(stats.successRate()).isZero();
        assertThat(stats.lastUpdated()).isEqualTo(NOW);
    }

    @Test
    void record_countsOutcomes() {
        GlobalStatsAggregator aggregator = new GlobalStatsAggregator();
        aggregator.record(true, 100);
        aggregator.record(false, 100);
        aggregator.record(true, 100);

        GlobalReconnectionStats stats = aggregator.snapshot(2, NOW);

        assertThat(stats.totalAttempts()).isEqualTo(3);
        assertThat(stats.successfulReconnections()).isEqualTo(2);
        assertThat(stats.failedReconnections()).isEqualTo(1);
        assertThat(stats.activeClients()).isEqualTo(2);
        assertThat(stats.successRate()).isCloseTo(2.0 / 3, within(1e-9));
    }

    @Test
    void record_smoothsAverageTowardsLatestSample() {
        GlobalStatsAggregator aggregator = new GlobalStatsAggregator();

        aggregator.record(true, 1000);
        assertThat(aggregator.snapshot(1, NOW).averageReconnectionTimeMs()).isEqualTo(500.0);

        aggregator.record(true, 3000);
        assertThat(aggregator.snapshot(1, NOW).averageReconnectionTimeMs()).isEqualTo(1750.0);

        aggregator.record(false, 250);
        assertThat(aggregator.snapshot(1, NOW).averageReconnectionTimeMs()).isEqualTo(1000.0);
    }
}
