package kr.jemi.boxoffice.seat.infrastructure.out.memory;

import kr.jemi.boxoffice.common.exception.SeatInvariantViolationException;
import kr.jemi.boxoffice.seat.domain.ReserveResult;
import kr.jemi.boxoffice.seat.domain.SeatState;
import kr.jemi.boxoffice.seat.domain.SeatStatus;
import kr.jemi.boxoffice.seat.domain.TransitionResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeatInMemoryAdapterTest {

    private static final long SHOW = 1L;
    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");
    private static final Instant EXPIRES_AT = NOW.plusSeconds(600);

    private final SeatInMemoryAdapter adapter = new SeatInMemoryAdapter();

    @Nested
    @DisplayName("reserveSeats")
    class Reserve {

        @Test
        @DisplayName("모든 좌석이 비어 있으면 전부 HELD가 된다")
        void reserveAll() {
            // when
            ReserveResult result = adapter.reserveSeats(SHOW, List.of("A1", "A2"), "token-1", EXPIRES_AT);

            // then
            assertThat(result.isReserved()).isTrue();
            assertThat(adapter.getStates(SHOW, List.of("A1", "A2")).countOf(SeatStatus.HELD)).isEqualTo(2);
        }

        @Test
        @DisplayName("하나라도 점유되어 있으면 아무것도 바꾸지 않고 충돌 좌석만 반환한다")
        void allOrNothing() {
            // given
            adapter.reserveSeats(SHOW, List.of("A2"), "token-1", EXPIRES_AT);

            // when
            ReserveResult result = adapter.reserveSeats(SHOW, List.of("A1", "A2", "A3"), "token-2", EXPIRES_AT);

            // then
            assertThat(result.conflictedSeatIds()).containsExactly("A2");
            assertThat(adapter.getStates(SHOW, List.of("A1", "A3")).countOf(SeatStatus.AVAILABLE)).isEqualTo(2);
        }

        @Test
        @DisplayName("다른 상영의 같은 좌석 ID와는 충돌하지 않는다")
        void isolatedPerShow() {
            // given
            adapter.reserveSeats(SHOW, List.of("A1"), "token-1", EXPIRES_AT);

            // when
            ReserveResult result = adapter.reserveSeats(2L, List.of("A1"), "token-2", EXPIRES_AT);

            // then
            assertThat(result.isReserved()).isTrue();
        }
    }

    @Nested
    @DisplayName("releaseSeats")
    class Release {

        @Test
        @DisplayName("토큰 소유 좌석을 모두 AVAILABLE로 되돌린다")
        void release() {
            // given
            adapter.reserveSeats(SHOW, List.of("A1", "A2"), "token-1", EXPIRES_AT);

            // when
            TransitionResult result = adapter.releaseSeats(SHOW, List.of("A1", "A2"), "token-1");

            // then
            assertThat(result).isEqualTo(TransitionResult.APPLIED);
            assertThat(adapter.getStates(SHOW, List.of("A1", "A2")).countOf(SeatStatus.AVAILABLE)).isEqualTo(2);
        }

        @Test
        @DisplayName("다른 토큰의 좌석은 건드리지 않고 NOT_FOUND")
        void otherToken() {
            // given
            adapter.reserveSeats(SHOW, List.of("A1"), "token-1", EXPIRES_AT);

            // when
            TransitionResult result = adapter.releaseSeats(SHOW, List.of("A1"), "token-2");

            // then
            assertThat(result).isEqualTo(TransitionResult.NOT_FOUND);
            assertThat(adapter.getStates(SHOW, List.of("A1")).of("A1").isHeldBy("token-1")).isTrue();
        }

        @Test
        @DisplayName("일부 좌석만 소유 중이면 불변식 위반 예외")
        void partial() {
            // given
            adapter.reserveSeats(SHOW, List.of("A1"), "token-1", EXPIRES_AT);

            // when & then
            assertThatThrownBy(() -> adapter.releaseSeats(SHOW, List.of("A1", "A2"), "token-1"))
                    .isInstanceOf(SeatInvariantViolationException.class);
        }
    }

    @Nested
    @DisplayName("finalizeSeats / freeSeats")
    class FinalizeAndFree {

        @Test
        @DisplayName("finalize는 HELD를 BOOKED로 바꾸고 카운터를 좌석 수만큼 올린다")
        void finalizeBooks() {
            // given
            adapter.reserveSeats(SHOW, List.of("A1", "A2"), "token-1", EXPIRES_AT);

            // when
            TransitionResult result = adapter.finalizeSeats(SHOW, List.of("A1", "A2"), "token-1", "BK1", NOW);

            // then
            assertThat(result).isEqualTo(TransitionResult.APPLIED);
            assertThat(adapter.getStates(SHOW, List.of("A1")).of("A1")).isEqualTo(SeatState.booked("BK1"));
            assertThat(adapter.countBooked(SHOW)).isEqualTo(2);
        }

        @Test
        @DisplayName("만료 시각이 지난 선점은 finalize하지 않고 EXPIRED")
        void finalizeExpired() {
            // given
            adapter.reserveSeats(SHOW, List.of("A1"), "token-1", EXPIRES_AT);

            // when
            TransitionResult result = adapter.finalizeSeats(SHOW, List.of("A1"), "token-1", "BK1", EXPIRES_AT);

            // then
            assertThat(result).isEqualTo(TransitionResult.EXPIRED);
            assertThat(adapter.getStates(SHOW, List.of("A1")).of("A1").isHeldBy("token-1")).isTrue();
            assertThat(adapter.countBooked(SHOW)).isZero();
        }

        @Test
        @DisplayName("free는 예매 좌석을 비우고 카운터를 내린다")
        void free() {
            // given
            adapter.reserveSeats(SHOW, List.of("A1", "A2"), "token-1", EXPIRES_AT);
            adapter.finalizeSeats(SHOW, List.of("A1", "A2"), "token-1", "BK1", NOW);

            // when
            TransitionResult result = adapter.freeSeats(SHOW, List.of("A1", "A2"), "BK1");

            // then
            assertThat(result).isEqualTo(TransitionResult.APPLIED);
            assertThat(adapter.countBooked(SHOW)).isZero();
            assertThat(adapter.reserveSeats(SHOW, List.of("A1"), "token-2", EXPIRES_AT).isReserved()).isTrue();
        }

        @Test
        @DisplayName("이미 비운 예매를 다시 free하면 NOT_FOUND")
        void freeTwice() {
            // given
            adapter.reserveSeats(SHOW, List.of("A1"), "token-1", EXPIRES_AT);
            adapter.finalizeSeats(SHOW, List.of("A1"), "token-1", "BK1", NOW);
            adapter.freeSeats(SHOW, List.of("A1"), "BK1");

            // when & then
            assertThat(adapter.freeSeats(SHOW, List.of("A1"), "BK1")).isEqualTo(TransitionResult.NOT_FOUND);
            assertThat(adapter.countBooked(SHOW)).isZero();
        }
    }

    @Test
    @DisplayName("renew는 만료 전 선점만 새 만료 시각으로 갱신한다")
    void renew() {
        // given
        adapter.reserveSeats(SHOW, List.of("A1"), "token-1", EXPIRES_AT);
        Instant extended = EXPIRES_AT.plusSeconds(600);

        // when
        TransitionResult result = adapter.renewSeats(SHOW, List.of("A1"), "token-1", extended, NOW);

        // then
        assertThat(result).isEqualTo(TransitionResult.APPLIED);
        assertThat(adapter.getStates(SHOW, List.of("A1")).of("A1").heldUntil()).isEqualTo(extended);
        assertThat(adapter.renewSeats(SHOW, List.of("A1"), "token-1", extended.plusSeconds(1), extended))
                .isEqualTo(TransitionResult.EXPIRED);
    }

    @Test
    @DisplayName("동시 선점 경쟁: 겹치는 좌석 묶음을 노리는 50개 스레드 중 정확히 1개만 성공")
    void concurrentReserveOnlyOneWins() throws InterruptedException {
        int threadCount = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        CountDownLatch readyLatch = new CountDownLatch(threadCount);
        CountDownLatch startLatch = new CountDownLatch(1);
        AtomicInteger successCount = new AtomicInteger();
        AtomicInteger conflictCount = new AtomicInteger();

        for (int i = 0; i < threadCount; i++) {
            String token = "token-" + i;
            // 스레드마다 좌석 순서를 뒤집어 락 순서 교착을 유도한다
            List<String> seatIds = i % 2 == 0 ? List.of("B1", "B2", "B3") : List.of("B3", "B2", "B1");
            executor.submit(() -> {
                readyLatch.countDown();
                try {
                    startLatch.await();
                    ReserveResult result = adapter.reserveSeats(SHOW, seatIds, token, EXPIRES_AT);
                    if (result.isReserved()) {
                        successCount.incrementAndGet();
                    } else {
                        conflictCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        readyLatch.await();
        startLatch.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).as("교착 없이 종료").isTrue();

        assertThat(successCount).as("성공 수").hasValue(1);
        assertThat(conflictCount).as("충돌 수").hasValue(threadCount - 1);
        assertThat(adapter.getStates(SHOW, List.of("B1", "B2", "B3")).countOf(SeatStatus.HELD)).isEqualTo(3);
    }

    @Test
    @DisplayName("상영이 많아져도 락 스트라이프 수는 고정이고, 한 묶음이 같은 스트라이프에 몰려도 교착 없이 전이한다")
    void lockStripesStayBoundedAcrossShows() throws InterruptedException {
        SeatInMemoryAdapter striped = new SeatInMemoryAdapter(4);
        int threadCount = 8;
        int showsPerThread = 250;
        List<String> seatIds = List.of("A1", "A2", "A3", "A4", "A5", "A6", "A7", "A8", "A9", "A10");
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);
        AtomicInteger applied = new AtomicInteger();

        for (int t = 0; t < threadCount; t++) {
            long firstShow = 1000L + (long) t * showsPerThread;
            executor.submit(() -> {
                for (long show = firstShow; show < firstShow + showsPerThread; show++) {
                    String token = "token-" + show;
                    striped.reserveSeats(show, seatIds, token, EXPIRES_AT);
                    striped.finalizeSeats(show, seatIds, token, "BK" + show, NOW);
                    if (striped.freeSeats(show, seatIds, "BK" + show) == TransitionResult.APPLIED) {
                        applied.incrementAndGet();
                    }
                }
            });
        }

        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).as("교착 없이 종료").isTrue();

        assertThat(applied).hasValue(threadCount * showsPerThread);
        assertThat(striped.lockStripeCount()).isEqualTo(4);
        assertThat(striped.countBooked(1000L)).isZero();
        assertThat(striped.getStates(2999L, seatIds).countOf(SeatStatus.AVAILABLE)).isEqualTo(seatIds.size());
    }

    @Test
    @DisplayName("락 스트라이프는 1개 이상이어야 한다")
    void rejectsZeroStripes() {
        assertThatThrownBy(() -> new SeatInMemoryAdapter(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
