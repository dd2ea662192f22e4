package kr.jemi.boxoffice.broadcast.domain;

public interface SeatChangeSubscriber {

    /**
     * @return 전달했으면 true, 연결이 끊겨 더 이상 받을 수 없으면 false
     */
    boolean deliver(SeatChange change);
}
