package personal.cinema.core.booking.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.cinema.core.booking.adapter.in.web.dto.AvailabilityResponse;
import personal.cinema.core.booking.adapter.in.web.dto.SeatMapResponse;
import personal.cinema.core.booking.application.port.in.GetAvailableSeatsUseCase;

import java.util.List;

/**
 * Showing API Controller
 * 상영별 좌석 가용성 조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/showings")
@RequiredArgsConstructor
public class ShowingController {

    private final GetAvailableSeatsUseCase getAvailableSeatsUseCase;

    /**
     * 구매 가능 좌석 ID 목록
     * GET /api/v1/showings/{showingId}/availability
     */
    @GetMapping("/{showingId}/availability")
    public ResponseEntity<AvailabilityResponse> getAvailability(@PathVariable Long showingId) {
        log.info("Get availability: showingId={}", showingId);

        List<Long> seatIds = getAvailableSeatsUseCase.getAvailableSeatIds(showingId);

        return ResponseEntity.ok(new AvailabilityResponse(showingId, seatIds));
    }

    /**
     * 좌석 배치도 (좌석별 상태와 가격)
     * GET /api/v1/showings/{showingId}/seats
     */
    @GetMapping("/{showingId}/seats")
    public ResponseEntity<List<SeatMapResponse>> getSeatMap(@PathVariable Long showingId) {
        List<SeatMapResponse> response = getAvailableSeatsUseCase.getSeatMap(showingId).stream()
                .map(SeatMapResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }
}
