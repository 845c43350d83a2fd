package org.javai.reconnect.tracking;

import org.javai.reconnect.AttemptRecord;
import org.javai.reconnect.AttemptTrackedEvent;
import org.javai.reconnect.ClientReconnectionState;
import org.javai.reconnect.MutableClock;
import org.javai.reconnect.ops.ReconnectionListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class ClientStateStoreTest {

    private static final Instant START = Instant.parse("2024-01-20T10:30:00Z");

    private MutableClock clock;
    private GlobalStatsAggregator globalStats;
    private RecordingListener listener;
    private ClientStateStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        globalStats = new GlobalStatsAggregator();
        listener = new RecordingListener();
        store = new ClientStateStore(globalStats, listener, clock);
    }

    @Test
    void track_createsStateOnFirstAttempt() {
        assertThat(store.find("socket-1")).isEmpty();

        ClientReconnectionState state = store.track("socket-1", 1, true, 250);

        assertThat(state.attempts()).isEqualTo(1);
        assertThat(state.successes()).isEqualTo(1);
        assertThat(state.failures()).isZero();
        assertThat(state.totalDurationMs()).isEqualTo(250.0);
        assertThat(state.lastAttempt()).isEqualTo(new AttemptRecord(1, true, 250, START.toEpochMilli()));
        assertThat(store.find("socket-1")).contains(state);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void track_keepsAttemptsEqualToSuccessesPlusFailures() {
        store.track("socket-1", 1, false, 100);
        store.track("socket-1", 2, false, 200);
        ClientReconnectionState state = store.track("socket-1", 3, true, 300);

        assertThat(state.attempts()).isEqualTo(3);
        assertThat(state.successes()).isEqualTo(1);
        assertThat(state.failures()).isEqualTo(2);
        assertThat(state.attempts()).isEqualTo(state.successes() + state.failures());
        assertThat(state.totalDurationMs()).isEqualTo(600.0);
    }

    @Test
    void track_keepsOnlyTheLatestTwentyPatterns() {
        for (int i = 1; i <= 25; i++) {
            store.track("socket-1", i, i % 2 == 0, i * 10);
        }

        ClientReconnectionState state = store.find("socket-1").orElseThrow();
        assertThat(state.attempts()).isEqualTo(25);
        assertThat(state.patterns()).hasSize(ClientReconnectionState.MAX_PATTERNS);
        assertThat(state.patterns().get(0).attempt()).isEqualTo(6);
        assertThat(state.patterns().get(19).attempt()).isEqualTo(25);
    }

    @Test
    void track_stampsAttemptsWithClockTime() {
        store.track("socket-1", 1, false, 100);
        clock.advance(Duration.ofSeconds(5));
        ClientReconnectionState state = store.track("socket-1", 2, true, 100);

        assertThat(state.patterns()).extracting(AttemptRecord::timestamp)
                .containsExactly(START.toEpochMilli(), START.plusSeconds(5).toEpochMilli());
    }

    @Test
    void track_notifiesListenerWithUpdatedState() {
        ClientReconnectionState state = store.track("socket-1", 1, false, 400);

        assertThat(listener.tracked).hasSize(1);
        AttemptTrackedEvent event = listener.tracked.get(0);
        assertThat(event.clientId()).isEqualTo("socket-1");
        assertThat(event.attempt().durationMs()).isEqualTo(400.0);
        assertThat(event.state()).isEqualTo(state);
    }

    @Test
    void track_updatesGlobalStats() {
        store.track("socket-1", 1, false, 1000);
        store.track("socket-2", 1, true, 3000);

        var stats = globalStats.snapshot(store.size(), START);
        assertThat(stats.totalAttempts()).isEqualTo(2);
        assertThat(stats.successfulReconnections()).isEqualTo(1);
        assertThat(stats.failedReconnections()).isEqualTo(1);
        assertThat(stats.activeClients()).isEqualTo(2);
    }

    @Test
    void track_rejectsInvalidInput() {
        assertThatThrownBy(() -> store.track(null, 1, true, 10))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> store.track("socket-1", 1, true, -5))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(store.find("socket-1")).isEmpty();
    }

    @Test
    void track_concurrentUpdatesToSameClientAreNotLost() throws Exception {
        int threads = 8;
        int perThread = 250;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                final boolean success = t % 2 == 0;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.track("shared", i + 1, success, 10);
                        store.track("own-" + Thread.currentThread().getId(), i + 1, success, 10);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        ClientReconnectionState shared = store.find("shared").orElseThrow();
        assertThat(shared.attempts()).isEqualTo(threads * perThread);
        assertThat(shared.successes()).isEqualTo(threads / 2 * perThread);
        assertThat(shared.failures()).isEqualTo(threads / 2 * perThread);
        assertThat(shared.patterns()).hasSize(ClientReconnectionState.MAX_PATTERNS);
        assertThat(globalStats.snapshot(0, START).totalAttempts()).isEqualTo(2L * threads * perThread);
    }

    @Test
    void reset_removesStateAndNotifies() {
        store.track("socket-1", 1, true, 10);

        assertThat(store.reset("socket-1")).isTrue();

        assertThat(store.find("socket-1")).isEmpty();
        assertThat(listener.reset).containsExactly("socket-1");
    }

    @Test
    void reset_unknownClient_isNoOp() {
        assertThat(store.reset("missing")).isFalse();
        assertThat(listener.reset).isEmpty();
    }

    @Test
    void reset_thenTrack_startsFromEmptyState() {
        store.track("socket-1", 1, false, 10);
        store.track("socket-1", 2, false, 10);
        store.reset("socket-1");

        ClientReconnectionState state = store.track("socket-1", 1, true, 10);

        assertThat(state.attempts()).isEqualTo(1);
        assertThat(state.patterns()).hasSize(1);
    }

    @Test
    void evictIdleBefore_removesOnlyIdleClients() {
        store.track("old", 1, true, 10);
        clock.advance(Duration.ofHours(2));
        store.track("fresh", 1, true, 10);

        var evicted = store.evictIdleBefore(START.plus(Duration.ofHours(1)).toEpochMilli());

        assertThat(evicted).containsOnlyKeys("old");
        assertThat(store.find("old")).isEmpty();
        assertThat(store.find("fresh")).isPresent();
        assertThat(listener.evicted).containsExactly("old");
    }

    private static final class RecordingListener implements ReconnectionListener {
        final List<AttemptTrackedEvent> tracked = Collections.synchronizedList(new ArrayList<>());
        final List<String> reset = new ArrayList<>();
        final List<String> evicted = new ArrayList<>();

        @Override
        public void onAttemptTracked(AttemptTrackedEvent event) {
            tracked.add(event);
        }

        @Override
        public void onClientStateReset(String clientId) {
            reset.add(clientId);
        }

        @Override
        public void onClientStateEvicted(String clientId, ClientReconnectionState state) {
            evicted.add(clientId);
        }
    }
}
