package personal.cinema.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import personal.cinema.core.booking.application.port.in.SweepExpiredUseCase;
import personal.cinema.core.booking.application.port.out.BookingRepository;
import personal.cinema.core.booking.domain.service.BookingManager;
import personal.cinema.core.booking.domain.service.ReservationManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Expiry Sweep Service
 * 읽기 경로에서 이미 만료로 취급되는 홀드/예매를 저장소에 반영한다.
 * 예매는 한 건씩 별도 트랜잭션으로 처리하여 한 건의 실패가 나머지를 막지 않도록 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpirySweepService implements SweepExpiredUseCase {

    private final ReservationManager reservationManager;
    private final BookingManager bookingManager;
    private final BookingRepository bookingRepository;
    private final Clock clock;

    @Override
    public int sweepExpiredHolds() {
        int removed = reservationManager.deleteExpiredHolds(LocalDateTime.now(clock));
        if (removed > 0) {
            log.info("Expired holds removed: count={}", removed);
        }
        return removed;
    }

    @Override
    public int sweepExpiredBookings() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<Long> candidates = bookingRepository.findExpiredPendingIds(now);

        int expired = 0;
        for (Long bookingId : candidates) {
            try {
                if (bookingManager.expireBooking(bookingId, now)) {
                    expired++;
                }
            } catch (Exception e) {
                log.error("Failed to expire booking: bookingId={}", bookingId, e);
            }
        }

        if (expired > 0) {
            log.info("Expired bookings swept: count={}, candidates={}", expired, candidates.size());
        }
        return expired;
    }
}
