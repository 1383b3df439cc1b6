package personal.cinema.core.booking.adapter.in.web.dto;

import personal.cinema.core.booking.domain.model.BookedSeat;
import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 예매 조회/생성 응답 DTO
 */
public record BookingResponse(
        Long bookingId,
        String bookingReference,
        Long showingId,
        BookingStatus status,
        BigDecimal totalAmount,
        LocalDateTime bookedAt,
        LocalDateTime expiresAt,
        LocalDateTime confirmedAt,
        LocalDateTime cancelledAt,
        String paymentMethod,
        String paymentReference,
        String notes,
        List<BookedSeatResponse> seats
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.id(),
                booking.bookingReference(),
                booking.showingId(),
                booking.status(),
                booking.totalAmount(),
                booking.bookedAt(),
                booking.expiresAt(),
                booking.confirmedAt(),
                booking.cancelledAt(),
                booking.paymentMethod(),
                booking.paymentReference(),
                booking.notes(),
                booking.seats().stream().map(BookedSeatResponse::from).toList()
        );
    }

    public record BookedSeatResponse(Long seatId, BigDecimal pricePaid) {
        static BookedSeatResponse from(BookedSeat seat) {
            return new BookedSeatResponse(seat.seatId(), seat.pricePaid());
        }
    }
}
