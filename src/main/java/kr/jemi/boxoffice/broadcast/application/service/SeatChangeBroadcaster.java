package kr.jemi.boxoffice.broadcast.application.service;

import kr.jemi.boxoffice.broadcast.application.port.in.BroadcastSeatChangeUseCase;
import kr.jemi.boxoffice.broadcast.application.port.in.SubscribeSeatChangesUseCase;
import kr.jemi.boxoffice.broadcast.domain.SeatChange;
import kr.jemi.boxoffice.broadcast.domain.SeatChangeSubscriber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 같은 상영을 보고 있는 구독자에게 좌석 변경을 전달한다. 정합성 상태를 갖지 않으며
 * 전달 실패는 해당 구독자만 제거하고 끝낸다.
 */
@Service
public class SeatChangeBroadcaster implements SubscribeSeatChangesUseCase, BroadcastSeatChangeUseCase {

    private static final Logger log = LoggerFactory.getLogger(SeatChangeBroadcaster.class);

    private final Map<Long, CopyOnWriteArrayList<SeatChangeSubscriber>> subscribersByShow = new ConcurrentHashMap<>();

    @Override
    public void subscribe(long showId, SeatChangeSubscriber subscriber) {
        // 마지막 구독 해제와 겹쳐도 새 구독자가 맵에서 빠지지 않도록 추가까지 한 번에 수행한다
        subscribersByShow.compute(showId, (id, subscribers) -> {
            CopyOnWriteArrayList<SeatChangeSubscriber> target =
                    subscribers == null ? new CopyOnWriteArrayList<>() : subscribers;
            target.add(subscriber);
            return target;
        });
    }

    @Override
    public void unsubscribe(long showId, SeatChangeSubscriber subscriber) {
        subscribersByShow.computeIfPresent(showId, (id, subscribers) -> {
            subscribers.remove(subscriber);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }

    @Override
    public void broadcast(SeatChange change) {
        List<SeatChangeSubscriber> subscribers = subscribersByShow.getOrDefault(change.showId(), new CopyOnWriteArrayList<>());
        for (SeatChangeSubscriber subscriber : subscribers) {
            boolean delivered;
            try {
                delivered = subscriber.deliver(change);
            } catch (RuntimeException e) {
                log.warn("좌석 변경 전달 실패, 구독 해제: show={}, event={}", change.showId(), change.eventType(), e);
                delivered = false;
            }
            if (!delivered) {
                unsubscribe(change.showId(), subscriber);
            }
        }
        log.debug("좌석 변경 전달: show={}, event={}, seats={}, subscribers={}",
                change.showId(), change.eventType(), change.seatIds(), subscribers.size());
    }

    public int countSubscribers(long showId) {
        List<SeatChangeSubscriber> subscribers = subscribersByShow.get(showId);
        return subscribers == null ? 0 : subscribers.size();
    }
}
