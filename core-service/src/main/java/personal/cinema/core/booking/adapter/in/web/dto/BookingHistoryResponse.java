package personal.cinema.core.booking.adapter.in.web.dto;

import personal.cinema.core.booking.domain.model.BookingAction;
import personal.cinema.core.booking.domain.model.BookingHistory;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 예매 감사 로그 응답 DTO
 */
public record BookingHistoryResponse(
        BookingAction action,
        String actor,
        LocalDateTime occurredAt,
        Map<String, String> metadata
) {
    public static BookingHistoryResponse from(BookingHistory history) {
        return new BookingHistoryResponse(
                history.action(),
                history.actor(),
                history.occurredAt(),
                history.metadata()
        );
    }
}
