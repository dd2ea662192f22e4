package kr.jemi.boxoffice.broadcast.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.boxoffice.broadcast.application.port.in.SubscribeSeatChangesUseCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;

@Tag(name = "Seat Events", description = "실시간 좌석 상태 구독")
@RestController
public class SeatEventStreamController {

    private static final Logger log = LoggerFactory.getLogger(SeatEventStreamController.class);

    private final SubscribeSeatChangesUseCase subscribeSeatChangesUseCase;
    private final Duration emitterTimeout;

    public SeatEventStreamController(SubscribeSeatChangesUseCase subscribeSeatChangesUseCase,
                                     @Value("${boxoffice.broadcast.emitter-timeout}") Duration emitterTimeout) {
        this.subscribeSeatChangesUseCase = subscribeSeatChangesUseCase;
        this.emitterTimeout = emitterTimeout;
    }

    @Operation(summary = "좌석 변경 구독", description = "선점, 해제, 예매, 취소로 인한 좌석 변경을 SSE로 전달합니다. 전달은 보장되지 않으므로 재연결 시 좌석 배치도를 다시 조회해야 합니다.")
    @GetMapping(value = "/api/shows/{showId}/seat-events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter subscribe(@PathVariable long showId) {
        SseEmitter emitter = new SseEmitter(emitterTimeout.toMillis());
        SseSeatChangeSubscriber subscriber = new SseSeatChangeSubscriber(emitter);

        emitter.onCompletion(() -> subscribeSeatChangesUseCase.unsubscribe(showId, subscriber));
        emitter.onTimeout(() -> subscribeSeatChangesUseCase.unsubscribe(showId, subscriber));
        emitter.onError(e -> subscribeSeatChangesUseCase.unsubscribe(showId, subscriber));
        subscribeSeatChangesUseCase.subscribe(showId, subscriber);

        try {
            emitter.send(SseEmitter.event().name("CONNECTED").data(showId));
        } catch (IOException e) {
            log.debug("SSE 연결 직후 전송 실패: show={}", showId);
            subscribeSeatChangesUseCase.unsubscribe(showId, subscriber);
            emitter.completeWithError(e);
        }
        return emitter;
    }
}
