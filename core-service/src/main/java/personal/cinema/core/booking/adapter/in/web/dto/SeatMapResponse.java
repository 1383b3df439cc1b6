package personal.cinema.core.booking.adapter.in.web.dto;

import personal.cinema.core.booking.domain.model.Seat;
import personal.cinema.core.booking.domain.model.SeatAvailability;
import personal.cinema.core.booking.domain.model.SeatState;
import personal.cinema.core.booking.domain.model.SeatType;

import java.math.BigDecimal;

/**
 * 좌석 배치도 항목 응답 DTO
 */
public record SeatMapResponse(
        Long seatId,
        String label,
        String rowLabel,
        int seatNumber,
        SeatType seatType,
        SeatState state,
        BigDecimal price,
        boolean accessible,
        boolean couple,
        int positionX,
        int positionY
) {
    public static SeatMapResponse from(SeatAvailability availability) {
        Seat seat = availability.seat();
        return new SeatMapResponse(
                seat.id(),
                seat.label(),
                seat.rowLabel(),
                seat.seatNumber(),
                seat.type(),
                availability.state(),
                availability.price(),
                seat.accessible(),
                seat.couple(),
                seat.positionX(),
                seat.positionY()
        );
    }
}
