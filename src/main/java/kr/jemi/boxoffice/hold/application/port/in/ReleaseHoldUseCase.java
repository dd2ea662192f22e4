package kr.jemi.boxoffice.hold.application.port.in;

public interface ReleaseHoldUseCase {

    void releaseHold(String token, String actor);
}
