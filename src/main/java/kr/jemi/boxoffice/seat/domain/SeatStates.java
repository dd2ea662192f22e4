package kr.jemi.boxoffice.seat.domain;

import jakarta.validation.constraints.NotNull;
import kr.jemi.boxoffice.common.validation.SelfValidating;

import java.util.List;
import java.util.Map;

public class SeatStates implements SelfValidating {

    @NotNull
    private final Map<String, SeatState> states;

    public SeatStates(Map<String, SeatState> states) {
        this.states = states == null ? null : Map.copyOf(states);
        validateSelf();
    }

    public SeatState of(String seatId) {
        SeatState state = states.get(seatId);
        if (state == null) {
            throw new IllegalArgumentException("조회하지 않은 좌석: " + seatId);
        }
        return state;
    }

    public List<String> seatIds() {
        return states.keySet().stream().sorted().toList();
    }

    public long countOf(SeatStatus status) {
        return states.values().stream()
                .filter(state -> state.status() == status)
                .count();
    }
}
