package personal.cinema.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Booking JPA Entity
 * 예매 테이블 매핑 (BookedSeat, BookingHistory는 예매 삭제 시 함께 삭제)
 */
@Entity
@Table(name = "bookings",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_booking_reference",
                columnNames = {"booking_reference"}
        ),
        indexes = {
                @Index(name = "idx_booking_user", columnList = "user_id, booked_at"),
                @Index(name = "idx_booking_status_expires", columnList = "status, expires_at"),
                @Index(name = "idx_booking_showing", columnList = "showing_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_reference", nullable = false, length = 32)
    private String bookingReference;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "showing_id", nullable = false)
    private Long showingId;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BookingStatus status;

    @Column(name = "booked_at", nullable = false, updatable = false)
    private LocalDateTime bookedAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

    @Column(name = "cancelled_at")
    private LocalDateTime cancelledAt;

    @Column(name = "payment_method", length = 50)
    private String paymentMethod;

    @Column(name = "payment_reference", length = 100)
    private String paymentReference;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @OneToMany(mappedBy = "booking", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("id ASC")
    private List<BookedSeatEntity> seats = new ArrayList<>();

    /**
     * 신규 예매 엔티티 생성 (좌석 포함)
     */
    public static BookingEntity fromDomain(Booking booking) {
        BookingEntity entity = new BookingEntity();
        entity.id = booking.id();
        entity.bookingReference = booking.bookingReference();
        entity.userId = booking.userId();
        entity.showingId = booking.showingId();
        entity.totalAmount = booking.totalAmount();
        entity.status = booking.status();
        entity.bookedAt = booking.bookedAt();
        entity.expiresAt = booking.expiresAt();
        entity.confirmedAt = booking.confirmedAt();
        entity.cancelledAt = booking.cancelledAt();
        entity.paymentMethod = booking.paymentMethod();
        entity.paymentReference = booking.paymentReference();
        entity.notes = booking.notes();
        booking.seats().forEach(seat -> entity.seats.add(BookedSeatEntity.of(entity, seat)));
        return entity;
    }

    public Booking toDomain() {
        return new Booking(id, bookingReference, userId, showingId, totalAmount, status,
                bookedAt, expiresAt, confirmedAt, cancelledAt, paymentMethod, paymentReference, notes,
                seats.stream().map(BookedSeatEntity::toDomain).toList());
    }

    /**
     * 상태 전이 결과 반영 (영속성 컨텍스트 내에서 사용)
     * 좌석과 금액은 생성 이후 바뀌지 않는다.
     */
    public void applyTransition(Booking booking) {
        this.status = booking.status();
        this.confirmedAt = booking.confirmedAt();
        this.cancelledAt = booking.cancelledAt();
        this.paymentMethod = booking.paymentMethod();
        this.paymentReference = booking.paymentReference();
    }
}
