package personal.cinema.core.booking.domain.model;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.core.booking.domain.exception.BookingExpiredException;
import personal.cinema.core.booking.domain.exception.BookingNotFoundException;
import personal.cinema.core.booking.domain.exception.InvalidBookingTransitionException;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Booking Domain Model
 * 예매 도메인 모델 (불변)
 * totalAmount는 생성 시점 좌석 가격 스냅샷의 합이며 이후 다시 계산하지 않는다.
 */
public record Booking(
        Long id,
        String bookingReference,
        Long userId,
        Long showingId,
        BigDecimal totalAmount,
        BookingStatus status,
        LocalDateTime bookedAt,
        LocalDateTime expiresAt,
        LocalDateTime confirmedAt,
        LocalDateTime cancelledAt,
        String paymentMethod,
        String paymentReference,
        String notes,
        List<BookedSeat> seats
) {
    public Booking {
        if (bookingReference == null || bookingReference.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking reference cannot be null or blank");
        }
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (showingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Showing ID cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking status cannot be null");
        }
        if (bookedAt == null || expiresAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking time window cannot be null");
        }
        if (seats == null || seats.isEmpty()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking must contain at least one seat");
        }
        seats = List.copyOf(seats);
    }

    /**
     * 예매 생성 (PENDING 상태)
     *
     * @param userId    사용자 ID
     * @param showingId 상영 ID
     * @param seats     좌석 및 가격 스냅샷
     * @param notes     메모 (선택)
     * @param now       현재 시각
     * @param ttl       결제 대기 시간
     * @return 새로운 예매
     */
    public static Booking create(Long userId, Long showingId, List<BookedSeat> seats, String notes,
                                 LocalDateTime now, Duration ttl) {
        Set<Long> seen = new HashSet<>();
        for (BookedSeat seat : seats) {
            if (!seen.add(seat.seatId())) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        String.format("Duplicate seat in booking: seatId=%d", seat.seatId()));
            }
        }
        BigDecimal total = seats.stream()
                .map(BookedSeat::pricePaid)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        return new Booking(null, newReference(), userId, showingId, total, BookingStatus.PENDING,
                now, now.plus(ttl), null, null, null, null, notes, seats);
    }

    private static String newReference() {
        return UUID.randomUUID().toString().replace("-", "").toUpperCase();
    }

    // ========== Lifecycle ==========

    /**
     * 예매 확정 (PENDING -> CONFIRMED)
     *
     * @throws BookingExpiredException            결제 대기 시간이 지난 경우
     * @throws InvalidBookingTransitionException  PENDING이 아닌 경우
     */
    public Booking confirm(String method, String reference, LocalDateTime now) {
        if (status == BookingStatus.EXPIRED || isPastExpiry(now)) {
            throw new BookingExpiredException(id);
        }
        ensureTransition(BookingStatus.CONFIRMED);
        return new Booking(id, bookingReference, userId, showingId, totalAmount, BookingStatus.CONFIRMED,
                bookedAt, expiresAt, now, cancelledAt, method, reference, notes, seats);
    }

    /**
     * 예매 취소 (PENDING/CONFIRMED -> CANCELLED)
     * 상영 시작 여부는 호출자가 검증한다.
     */
    public Booking cancel(LocalDateTime now) {
        BookingStatus current = effectiveStatus(now);
        if (!current.canTransitionTo(BookingStatus.CANCELLED)) {
            throw new InvalidBookingTransitionException(id, current, BookingStatus.CANCELLED);
        }
        return new Booking(id, bookingReference, userId, showingId, totalAmount, BookingStatus.CANCELLED,
                bookedAt, expiresAt, confirmedAt, now, paymentMethod, paymentReference, notes, seats);
    }

    /**
     * 예매 만료 (PENDING -> EXPIRED)
     */
    public Booking expire() {
        ensureTransition(BookingStatus.EXPIRED);
        return new Booking(id, bookingReference, userId, showingId, totalAmount, BookingStatus.EXPIRED,
                bookedAt, expiresAt, confirmedAt, cancelledAt, paymentMethod, paymentReference, notes, seats);
    }

    private void ensureTransition(BookingStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidBookingTransitionException(id, status, target);
        }
    }

    // ========== Queries ==========

    /**
     * 결제 대기 시간이 지났는지 확인 (PENDING 상태에서만 의미가 있음)
     */
    public boolean isPastExpiry(LocalDateTime now) {
        return status == BookingStatus.PENDING && now.isAfter(expiresAt);
    }

    /**
     * 읽기 경로에서 사용하는 상태
     * 만료 시각이 지난 PENDING은 스윕 전이라도 EXPIRED로 본다.
     */
    public BookingStatus effectiveStatus(LocalDateTime now) {
        return isPastExpiry(now) ? BookingStatus.EXPIRED : status;
    }

    /**
     * 조회 응답용 사본 (상태를 effectiveStatus로 치환, 저장하지 않음)
     */
    public Booking asSeenAt(LocalDateTime now) {
        BookingStatus current = effectiveStatus(now);
        if (current == status) {
            return this;
        }
        return new Booking(id, bookingReference, userId, showingId, totalAmount, current,
                bookedAt, expiresAt, confirmedAt, cancelledAt, paymentMethod, paymentReference, notes, seats);
    }

    /**
     * 좌석을 점유하고 있는지 확인 (CONFIRMED 또는 만료 전 PENDING)
     */
    public boolean holdsSeats(LocalDateTime now) {
        BookingStatus current = effectiveStatus(now);
        return current == BookingStatus.CONFIRMED || current == BookingStatus.PENDING;
    }

    public List<Long> seatIds() {
        return seats.stream().map(BookedSeat::seatId).toList();
    }

    public boolean isOwnedBy(Long requestUserId) {
        return userId.equals(requestUserId);
    }

    /**
     * 소유권 검증
     * 타인의 예매는 존재하지 않는 것으로 취급한다.
     *
     * @throws BookingNotFoundException 소유자가 아닐 때
     */
    public void ensureOwnership(Long requestUserId) {
        if (!isOwnedBy(requestUserId)) {
            throw new BookingNotFoundException(id);
        }
    }
}
