package personal.cinema.core.booking.adapter.in.web.dto;

import personal.cinema.core.booking.domain.model.SeatReservation;

import java.time.LocalDateTime;

/**
 * 좌석 홀드 응답 DTO
 */
public record HoldResponse(
        Long reservationId,
        Long showingId,
        Long seatId,
        String sessionId,
        LocalDateTime createdAt,
        LocalDateTime expiresAt
) {
    public static HoldResponse from(SeatReservation reservation) {
        return new HoldResponse(
                reservation.id(),
                reservation.showingId(),
                reservation.seatId(),
                reservation.sessionId(),
                reservation.createdAt(),
                reservation.expiresAt()
        );
    }
}
