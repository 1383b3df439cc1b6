package personal.cinema.core.booking.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.cinema.core.booking.application.port.out.BookingRepository;
import personal.cinema.core.booking.domain.exception.BookingNotFoundException;
import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingStatus;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Booking Persistence Adapter
 * JPA를 사용한 예매 저장소 구현체
 * 신규 예매는 좌석과 함께 insert, 기존 예매는 상태 필드만 갱신한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingPersistenceAdapter implements BookingRepository {

    private final JpaBookingRepository jpaBookingRepository;

    @Override
    public Booking save(Booking booking) {
        log.debug("Saving booking: bookingId={}, status={}", booking.id(), booking.status());

        if (booking.id() == null) {
            return jpaBookingRepository.saveAndFlush(BookingEntity.fromDomain(booking)).toDomain();
        }

        BookingEntity entity = jpaBookingRepository.findById(booking.id())
                .orElseThrow(() -> new BookingNotFoundException(booking.id()));
        entity.applyTransition(booking);
        jpaBookingRepository.flush();
        return entity.toDomain();
    }

    @Override
    public Optional<Booking> findById(Long bookingId) {
        log.debug("Finding booking: bookingId={}", bookingId);
        return jpaBookingRepository.findById(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public Optional<Booking> findByIdForUpdate(Long bookingId) {
        log.debug("Locking booking: bookingId={}", bookingId);
        return jpaBookingRepository.findByIdForUpdate(bookingId)
                .map(BookingEntity::toDomain);
    }

    @Override
    public List<Booking> findByUserId(Long userId) {
        return jpaBookingRepository.findByUserIdWithSeats(userId).stream()
                .map(BookingEntity::toDomain)
                .toList();
    }

    @Override
    public Set<Long> findActiveSeatIds(Long showingId, LocalDateTime now) {
        return new HashSet<>(jpaBookingRepository.findActiveSeatIds(
                showingId, now, BookingStatus.CONFIRMED, BookingStatus.PENDING));
    }

    @Override
    public List<Long> findExpiredPendingIds(LocalDateTime now) {
        return jpaBookingRepository.findIdsByStatusAndExpiresAtBefore(BookingStatus.PENDING, now);
    }
}
