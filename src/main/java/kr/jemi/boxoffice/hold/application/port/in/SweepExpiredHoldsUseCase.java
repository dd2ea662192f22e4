package kr.jemi.boxoffice.hold.application.port.in;

public interface SweepExpiredHoldsUseCase {

    /**
     * @return 해제한 선점 수
     */
    int sweepExpired();
}
