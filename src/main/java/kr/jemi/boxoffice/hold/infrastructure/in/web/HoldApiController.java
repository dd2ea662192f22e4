package kr.jemi.boxoffice.hold.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.boxoffice.common.exception.ErrorCode;
import kr.jemi.boxoffice.hold.application.port.in.CreateHoldUseCase;
import kr.jemi.boxoffice.hold.application.port.in.ExtendHoldUseCase;
import kr.jemi.boxoffice.hold.application.port.in.ReleaseHoldUseCase;
import kr.jemi.boxoffice.hold.domain.HoldResult;
import kr.jemi.boxoffice.hold.infrastructure.in.web.dto.HoldRequest;
import kr.jemi.boxoffice.hold.infrastructure.in.web.dto.HoldResponse;
import kr.jemi.boxoffice.hold.infrastructure.in.web.dto.SeatConflictResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "Hold", description = "좌석 선점")
@RestController
public class HoldApiController {

    private final CreateHoldUseCase createHoldUseCase;
    private final ReleaseHoldUseCase releaseHoldUseCase;
    private final ExtendHoldUseCase extendHoldUseCase;

    public HoldApiController(CreateHoldUseCase createHoldUseCase,
                             ReleaseHoldUseCase releaseHoldUseCase,
                             ExtendHoldUseCase extendHoldUseCase) {
        this.createHoldUseCase = createHoldUseCase;
        this.releaseHoldUseCase = releaseHoldUseCase;
        this.extendHoldUseCase = extendHoldUseCase;
    }

    @Operation(summary = "좌석 선점", description = "좌석 묶음을 한 번에 선점합니다. 하나라도 점유된 좌석이 있으면 409와 함께 충돌 좌석 목록을 반환합니다.")
    @PostMapping("/api/shows/{showId}/holds")
    public ResponseEntity<?> createHold(
            @PathVariable long showId,
            @Parameter(description = "요청자 ID") @RequestHeader("X-Actor-Id") String actor,
            @Valid @RequestBody HoldRequest request) {
        HoldResult result = createHoldUseCase.createHold(showId, request.seatIds(), actor);
        if (!result.isCreated()) {
            return ResponseEntity.status(ErrorCode.SEAT_CONFLICT.getStatus())
                    .body(SeatConflictResponse.of(result.conflictedSeatIds()));
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(HoldResponse.from(result.hold()));
    }

    @Operation(summary = "선점 해제", description = "본인의 선점을 해제하고 좌석을 되돌립니다.")
    @DeleteMapping("/api/holds/{token}")
    public ResponseEntity<Void> releaseHold(
            @PathVariable String token,
            @Parameter(description = "요청자 ID") @RequestHeader("X-Actor-Id") String actor) {
        releaseHoldUseCase.releaseHold(token, actor);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "선점 연장", description = "선점 만료 시각을 현재 시각 기준으로 다시 늘립니다. 설정으로 허용된 경우에만 동작합니다.")
    @PatchMapping("/api/holds/{token}")
    public ResponseEntity<HoldResponse> extendHold(
            @PathVariable String token,
            @Parameter(description = "요청자 ID") @RequestHeader("X-Actor-Id") String actor) {
        return ResponseEntity.ok(HoldResponse.from(extendHoldUseCase.extendHold(token, actor)));
    }
}
