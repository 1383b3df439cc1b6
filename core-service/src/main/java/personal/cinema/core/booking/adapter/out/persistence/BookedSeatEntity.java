package personal.cinema.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cinema.core.booking.domain.model.BookedSeat;

import java.math.BigDecimal;

/**
 * Booked Seat JPA Entity
 * 예매 좌석과 예매 시점 가격 스냅샷
 */
@Entity
@Table(name = "booked_seats",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_booked_seat_booking_seat",
                columnNames = {"booking_id", "seat_id"}
        ),
        indexes = {
                @Index(name = "idx_booked_seat_seat", columnList = "seat_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookedSeatEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "booking_id", nullable = false)
    private BookingEntity booking;

    @Column(name = "seat_id", nullable = false)
    private Long seatId;

    @Column(name = "price_paid", nullable = false, precision = 10, scale = 2)
    private BigDecimal pricePaid;

    static BookedSeatEntity of(BookingEntity booking, BookedSeat seat) {
        BookedSeatEntity entity = new BookedSeatEntity();
        entity.id = seat.id();
        entity.booking = booking;
        entity.seatId = seat.seatId();
        entity.pricePaid = seat.pricePaid();
        return entity;
    }

    public BookedSeat toDomain() {
        return new BookedSeat(id, seatId, pricePaid);
    }
}
