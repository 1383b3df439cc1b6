package personal.cinema.core.booking.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.cinema.core.booking.application.port.in.CancelBookingCommand;
import personal.cinema.core.booking.application.port.in.CancelBookingUseCase;
import personal.cinema.core.booking.application.port.in.ConfirmBookingCommand;
import personal.cinema.core.booking.application.port.in.ConfirmBookingUseCase;
import personal.cinema.core.booking.application.port.in.CreateBookingCommand;
import personal.cinema.core.booking.application.port.in.CreateBookingUseCase;
import personal.cinema.core.booking.application.port.in.GetBookingUseCase;
import personal.cinema.core.booking.application.port.out.BookingHistoryRepository;
import personal.cinema.core.booking.application.port.out.BookingRepository;
import personal.cinema.core.booking.application.port.out.SeatLockRepository;
import personal.cinema.core.booking.domain.exception.BookingNotFoundException;
import personal.cinema.core.booking.domain.exception.SeatUnavailableException;
import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingHistory;
import personal.cinema.core.booking.domain.service.BookingManager;
import personal.cinema.core.config.BookingProperties;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Booking Application Service
 * 예매 생성/확정/취소/조회
 * 상태 전이는 BookingManager의 트랜잭션에 위임하고, 이 서비스는 트랜잭션 밖의 관심사만 다룬다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService implements
        CreateBookingUseCase,
        ConfirmBookingUseCase,
        CancelBookingUseCase,
        GetBookingUseCase {

    private final BookingManager bookingManager;
    private final BookingRepository bookingRepository;
    private final BookingHistoryRepository bookingHistoryRepository;
    private final SeatLockRepository seatLockRepository;
    private final BookingProperties bookingProperties;
    private final Clock clock;

    @Override
    public Booking createBooking(CreateBookingCommand command) {
        log.info("Creating booking: userId={}, showingId={}, seatIds={}",
                command.userId(), command.showingId(), command.seatIds());

        // 1. 좌석별 Fail-Fast 선점 (하나라도 실패하면 전부 해제)
        List<Long> lockedSeatIds = new ArrayList<>();
        try {
            for (Long seatId : command.seatIds()) {
                if (!seatLockRepository.tryLock(command.showingId(), seatId, command.userId())) {
                    log.warn("Seat lock contended: showingId={}, seatId={}", command.showingId(), seatId);
                    throw new SeatUnavailableException(command.showingId(), seatId, "being processed");
                }
                lockedSeatIds.add(seatId);
            }

            // 2. DB 트랜잭션 (검증, 홀드 소진, 예매/감사 로그/Outbox 저장)
            return bookingManager.createBookingInTransaction(
                    command, LocalDateTime.now(clock), bookingProperties.pendingTtl());

        } catch (DataIntegrityViolationException | PessimisticLockingFailureException e) {
            log.warn("Concurrent booking detected: showingId={}, seatIds={}",
                    command.showingId(), command.seatIds());
            throw new SeatUnavailableException(command.showingId(), command.seatIds().get(0), "concurrent booking");

        } finally {
            lockedSeatIds.forEach(seatId ->
                    seatLockRepository.unlock(command.showingId(), seatId, command.userId()));
        }
    }

    @Override
    public Booking confirmBooking(ConfirmBookingCommand command) {
        log.info("Confirming booking: bookingId={}, userId={}", command.bookingId(), command.userId());
        return bookingManager.confirmInTransaction(command, LocalDateTime.now(clock));
    }

    @Override
    public Booking cancelBooking(CancelBookingCommand command) {
        log.info("Cancelling booking: bookingId={}, userId={}", command.bookingId(), command.userId());
        return bookingManager.cancelInTransaction(command, LocalDateTime.now(clock));
    }

    @Override
    @Transactional(readOnly = true)
    public Booking getBooking(Long bookingId, Long userId) {
        return loadOwned(bookingId, userId).asSeenAt(LocalDateTime.now(clock));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Booking> getBookings(Long userId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return bookingRepository.findByUserId(userId).stream()
                .map(booking -> booking.asSeenAt(now))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<BookingHistory> getHistory(Long bookingId, Long userId) {
        loadOwned(bookingId, userId);
        return bookingHistoryRepository.findByBookingId(bookingId);
    }

    private Booking loadOwned(Long bookingId, Long userId) {
        Booking booking = bookingRepository.findById(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        booking.ensureOwnership(userId);
        return booking;
    }
}
