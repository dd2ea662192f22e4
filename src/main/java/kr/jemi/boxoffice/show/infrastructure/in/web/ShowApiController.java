package kr.jemi.boxoffice.show.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.boxoffice.show.application.port.in.GetAvailabilityUseCase;
import kr.jemi.boxoffice.show.application.port.in.GetSeatMapUseCase;
import kr.jemi.boxoffice.show.infrastructure.in.web.dto.AvailabilityResponse;
import kr.jemi.boxoffice.show.infrastructure.in.web.dto.SeatMapResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Show", description = "상영 좌석 조회")
@RestController
public class ShowApiController {

    private final GetSeatMapUseCase getSeatMapUseCase;
    private final GetAvailabilityUseCase getAvailabilityUseCase;

    public ShowApiController(GetSeatMapUseCase getSeatMapUseCase,
                             GetAvailabilityUseCase getAvailabilityUseCase) {
        this.getSeatMapUseCase = getSeatMapUseCase;
        this.getAvailabilityUseCase = getAvailabilityUseCase;
    }

    @Operation(summary = "좌석 배치도 조회", description = "상영관 전체 좌석의 등급, 가격, 현재 상태를 반환합니다. 실시간 이벤트 재연결 시 기준 데이터입니다.")
    @GetMapping("/api/shows/{showId}/seats")
    public ResponseEntity<SeatMapResponse> getSeatMap(@PathVariable long showId) {
        return ResponseEntity.ok(SeatMapResponse.from(getSeatMapUseCase.getSeatMap(showId)));
    }

    @Operation(summary = "잔여 좌석 조회", description = "전체 좌석 수, 예매 좌석 수, 잔여 좌석 수를 반환합니다.")
    @GetMapping("/api/shows/{showId}/availability")
    public ResponseEntity<AvailabilityResponse> getAvailability(@PathVariable long showId) {
        return ResponseEntity.ok(AvailabilityResponse.from(getAvailabilityUseCase.getAvailability(showId)));
    }
}
