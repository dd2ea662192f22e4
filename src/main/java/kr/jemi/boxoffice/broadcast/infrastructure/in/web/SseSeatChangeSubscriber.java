package kr.jemi.boxoffice.broadcast.infrastructure.in.web;

import kr.jemi.boxoffice.broadcast.domain.SeatChange;
import kr.jemi.boxoffice.broadcast.domain.SeatChangeSubscriber;
import kr.jemi.boxoffice.broadcast.infrastructure.in.web.dto.SeatChangeMessage;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;

public class SseSeatChangeSubscriber implements SeatChangeSubscriber {

    private final SseEmitter emitter;

    public SseSeatChangeSubscriber(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public boolean deliver(SeatChange change) {
        try {
            emitter.send(SseEmitter.event()
                    .name(change.eventType())
                    .data(SeatChangeMessage.from(change), MediaType.APPLICATION_JSON));
            return true;
        } catch (IOException | IllegalStateException e) {
            // 이미 닫힌 연결
            emitter.completeWithError(e);
            return false;
        }
    }
}
