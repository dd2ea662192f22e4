package kr.jemi.boxoffice.broadcast.application.service;

import kr.jemi.boxoffice.broadcast.domain.SeatChange;
import kr.jemi.boxoffice.broadcast.domain.SeatChangeSubscriber;
import kr.jemi.boxoffice.common.event.SeatsHeldEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SeatChangeBroadcasterTest {

    private static final SeatChange HELD = SeatChange.from(
            new SeatsHeldEvent(1L, List.of("A1", "A2"), "token-1", Instant.parse("2026-10-19T10:00:00Z")));

    private final SeatChangeBroadcaster broadcaster = new SeatChangeBroadcaster();

    @Test
    @DisplayName("같은 상영 구독자에게만 전달한다")
    void deliverToSameShow() {
        // given
        RecordingSubscriber show1 = new RecordingSubscriber(true);
        RecordingSubscriber show2 = new RecordingSubscriber(true);
        broadcaster.subscribe(1L, show1);
        broadcaster.subscribe(2L, show2);

        // when
        broadcaster.broadcast(HELD);

        // then
        assertThat(show1.received).containsExactly(HELD);
        assertThat(show2.received).isEmpty();
    }

    @Test
    @DisplayName("전달에 실패한 구독자는 제거되고 나머지는 계속 받는다")
    void dropFailedSubscriber() {
        // given
        RecordingSubscriber healthy = new RecordingSubscriber(true);
        RecordingSubscriber gone = new RecordingSubscriber(false);
        SeatChangeSubscriber broken = change -> {
            throw new IllegalStateException("closed");
        };
        broadcaster.subscribe(1L, gone);
        broadcaster.subscribe(1L, broken);
        broadcaster.subscribe(1L, healthy);

        // when
        broadcaster.broadcast(HELD);

        // then
        assertThat(healthy.received).containsExactly(HELD);
        assertThat(broadcaster.countSubscribers(1L)).isEqualTo(1);
    }

    @Test
    @DisplayName("마지막 구독자가 해제되면 상영 항목도 정리된다")
    void unsubscribeLast() {
        // given
        RecordingSubscriber subscriber = new RecordingSubscriber(true);
        broadcaster.subscribe(1L, subscriber);

        // when
        broadcaster.unsubscribe(1L, subscriber);
        broadcaster.broadcast(HELD);

        // then
        assertThat(broadcaster.countSubscribers(1L)).isZero();
        assertThat(subscriber.received).isEmpty();
    }

    @Test
    @DisplayName("마지막 구독자 해제와 새 구독이 겹쳐도 새 구독자는 계속 전달받는다")
    void subscribeRacingLastUnsubscribe() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 2_000; i++) {
                // given
                long showId = i;
                RecordingSubscriber leaving = new RecordingSubscriber(true);
                RecordingSubscriber joining = new RecordingSubscriber(true);
                broadcaster.subscribe(showId, leaving);
                CyclicBarrier barrier = new CyclicBarrier(2);

                // when
                Future<?> unsubscribe = executor.submit(() -> {
                    awaitTogether(barrier);
                    broadcaster.unsubscribe(showId, leaving);
                });
                Future<?> subscribe = executor.submit(() -> {
                    awaitTogether(barrier);
                    broadcaster.subscribe(showId, joining);
                });
                unsubscribe.get(5, TimeUnit.SECONDS);
                subscribe.get(5, TimeUnit.SECONDS);

                // then
                assertThat(broadcaster.countSubscribers(showId)).as("show %d", showId).isEqualTo(1);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static void awaitTogether(CyclicBarrier barrier) {
        try {
            barrier.await(5, TimeUnit.SECONDS);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static class RecordingSubscriber implements SeatChangeSubscriber {

        private final boolean alive;
        private final List<SeatChange> received = new ArrayList<>();

        RecordingSubscriber(boolean alive) {
            this.alive = alive;
        }

        @Override
        public boolean deliver(SeatChange change) {
            received.add(change);
            return alive;
        }
    }
}
