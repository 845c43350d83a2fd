package org.javai.reconnect;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ClientReconnectionStateTest {

    @Test
    void empty_hasNoHistory() {
        ClientReconnectionState state = ClientReconnectionState.empty();

        assertThat(state.attempts()).isZero();
        assertThat(state.lastAttempt()).isNull();
        assertThat(state.successRate(10)).isZero();
        assertThat(state.averageDurationMs()).isZero();
        assertThat(state.idleSince(Long.MAX_VALUE)).isFalse();
    }

    @Test
    void record_returnsNewStateAndLeavesOriginalUntouched() {
        ClientReconnectionState before = ClientReconnectionState.empty();
        AttemptRecord attempt = new AttemptRecord(1, false, 300, 1000L);

        ClientReconnectionState after = before.record(attempt);

        assertThat(before.attempts()).isZero();
        assertThat(after.attempts()).isEqualTo(1);
        assertThat(after.failures()).isEqualTo(1);
        assertThat(after.lastAttempt()).isSameAs(attempt);
        assertThat(after.patterns()).containsExactly(attempt);
    }

    @Test
    void recentPatterns_returnsNewestEntriesOldestFirst() {
        ClientReconnectionState built = ClientReconnectionState.empty();
        for (int i = 1; i <= 4; i++) {
            built = built.record(new AttemptRecord(i, i % 2 == 0, 100, i));
        }
        ClientReconnectionState state = built;

        assertThat(state.recentPatterns(2)).extracting(AttemptRecord::attempt).containsExactly(3, 4);
        assertThat(state.recentPatterns(10)).hasSize(4);
        assertThat(state.successRate(2)).isEqualTo(0.5);
        assertThatThrownBy(() -> state.recentPatterns(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void idleSince_comparesLastAttemptTimestamp() {
        ClientReconnectionState state = ClientReconnectionState.empty()
                .record(new AttemptRecord(1, true, 10, 5_000L));

        assertThat(state.idleSince(5_001L)).isTrue();
        assertThat(state.idleSince(5_000L)).isFalse();
    }

    @Test
    void constructor_rejectsInconsistentCounts() {
        assertThatThrownBy(() -> new ClientReconnectionState(3, 1, 1, 0, null, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void patterns_areImmutable() {
        ClientReconnectionState state = ClientReconnectionState.empty()
                .record(new AttemptRecord(1, true, 10, 1L));

        assertThatThrownBy(() -> state.patterns().clear()).isInstanceOf(UnsupportedOperationException.class);
    }
}
