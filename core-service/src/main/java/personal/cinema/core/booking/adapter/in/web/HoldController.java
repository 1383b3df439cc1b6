package personal.cinema.core.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.cinema.core.booking.adapter.in.web.dto.ExtendHoldRequest;
import personal.cinema.core.booking.adapter.in.web.dto.HoldResponse;
import personal.cinema.core.booking.adapter.in.web.dto.HoldSeatRequest;
import personal.cinema.core.booking.application.port.in.ExtendHoldUseCase;
import personal.cinema.core.booking.application.port.in.GetHoldsUseCase;
import personal.cinema.core.booking.application.port.in.HoldSeatUseCase;
import personal.cinema.core.booking.application.port.in.ReleaseHoldUseCase;
import personal.cinema.core.booking.domain.model.SeatReservation;

import java.util.List;

/**
 * Hold API Controller
 * 좌석 임시 홀드 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/holds")
@RequiredArgsConstructor
public class HoldController {

    private final HoldSeatUseCase holdSeatUseCase;
    private final ExtendHoldUseCase extendHoldUseCase;
    private final ReleaseHoldUseCase releaseHoldUseCase;
    private final GetHoldsUseCase getHoldsUseCase;

    /**
     * 좌석 홀드 생성
     * POST /api/v1/holds
     */
    @PostMapping
    public ResponseEntity<HoldResponse> holdSeat(
            @Valid @RequestBody HoldSeatRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Hold seat: userId={}, showingId={}, seatId={}", userId, request.showingId(), request.seatId());

        SeatReservation reservation = holdSeatUseCase.holdSeat(request.toCommand(userId));

        return ResponseEntity.status(HttpStatus.CREATED).body(HoldResponse.from(reservation));
    }

    /**
     * 홀드 연장
     * POST /api/v1/holds/{reservationId}/extend
     */
    @PostMapping("/{reservationId}/extend")
    public ResponseEntity<HoldResponse> extendHold(
            @PathVariable Long reservationId,
            @Valid @RequestBody(required = false) ExtendHoldRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        Integer minutes = request != null ? request.minutes() : null;
        log.info("Extend hold: reservationId={}, userId={}, minutes={}", reservationId, userId, minutes);

        SeatReservation extended = extendHoldUseCase.extendHold(reservationId, userId, minutes);

        return ResponseEntity.ok(HoldResponse.from(extended));
    }

    /**
     * 홀드 해제 (멱등)
     * DELETE /api/v1/holds/{reservationId}
     */
    @DeleteMapping("/{reservationId}")
    public ResponseEntity<Void> releaseHold(
            @PathVariable Long reservationId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Release hold: reservationId={}, userId={}", reservationId, userId);

        releaseHoldUseCase.releaseHold(reservationId, userId);

        return ResponseEntity.noContent().build();
    }

    /**
     * 내 홀드 목록
     * GET /api/v1/holds
     */
    @GetMapping
    public ResponseEntity<List<HoldResponse>> getHolds(@RequestHeader("X-User-Id") Long userId) {
        List<HoldResponse> response = getHoldsUseCase.getActiveHolds(userId).stream()
                .map(HoldResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }
}
