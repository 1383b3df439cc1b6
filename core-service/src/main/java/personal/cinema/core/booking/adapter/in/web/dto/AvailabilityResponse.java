package personal.cinema.core.booking.adapter.in.web.dto;

import java.util.List;

/**
 * 상영별 구매 가능 좌석 응답 DTO
 */
public record AvailabilityResponse(
        Long showingId,
        List<Long> availableSeatIds
) {
}
