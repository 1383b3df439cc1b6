package personal.cinema.core.booking.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.cinema.core.booking.application.port.in.CancelBookingCommand;
import personal.cinema.core.booking.application.port.in.ConfirmBookingCommand;
import personal.cinema.core.booking.application.port.in.CreateBookingCommand;
import personal.cinema.core.booking.application.port.out.BookingEventPort;
import personal.cinema.core.booking.application.port.out.BookingHistoryRepository;
import personal.cinema.core.booking.application.port.out.BookingRepository;
import personal.cinema.core.booking.application.port.out.SeatRepository;
import personal.cinema.core.booking.application.port.out.SeatReservationRepository;
import personal.cinema.core.booking.application.port.out.ShowingRepository;
import personal.cinema.core.booking.domain.exception.BookingExpiredException;
import personal.cinema.core.booking.domain.exception.BookingNotFoundException;
import personal.cinema.core.booking.domain.exception.InvalidBookingTransitionException;
import personal.cinema.core.booking.domain.exception.SeatNotFoundException;
import personal.cinema.core.booking.domain.exception.SeatUnavailableException;
import personal.cinema.core.booking.domain.exception.ShowingNotFoundException;
import personal.cinema.core.booking.domain.model.BookedSeat;
import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingAction;
import personal.cinema.core.booking.domain.model.BookingHistory;
import personal.cinema.core.booking.domain.model.BookingStatus;
import personal.cinema.core.booking.domain.model.Seat;
import personal.cinema.core.booking.domain.model.SeatReservation;
import personal.cinema.core.booking.domain.model.Showing;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Booking Domain Service (Transaction Manager)
 * 예매 상태 머신의 각 전이를 하나의 트랜잭션으로 실행한다.
 * 예매 저장, 감사 로그, Outbox 이벤트가 항상 함께 커밋된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingManager {

    private final ShowingRepository showingRepository;
    private final SeatRepository seatRepository;
    private final SeatReservationRepository seatReservationRepository;
    private final BookingRepository bookingRepository;
    private final BookingHistoryRepository bookingHistoryRepository;
    private final BookingEventPort bookingEventPort;
    private final AvailabilityResolver availabilityResolver;

    /**
     * 트랜잭션 내에서 예매 생성 (전부 성공 또는 전부 실패)
     * 요청자가 가진 홀드는 같은 트랜잭션에서 예매로 전환되어 삭제된다.
     */
    @Transactional
    public Booking createBookingInTransaction(CreateBookingCommand command, LocalDateTime now, Duration ttl) {
        // 1. 상영 잠금
        Showing showing = showingRepository.findByIdForUpdate(command.showingId())
                .orElseThrow(() -> new ShowingNotFoundException(command.showingId()));

        // 2. 좌석 조회 및 상영관 검증
        Map<Long, Seat> seatsById = seatRepository.findAllById(command.seatIds()).stream()
                .collect(Collectors.toMap(Seat::id, Function.identity()));
        List<Seat> seats = new ArrayList<>();
        for (Long seatId : command.seatIds()) {
            Seat seat = seatsById.get(seatId);
            if (seat == null) {
                throw new SeatNotFoundException(seatId);
            }
            if (!seat.isOnScreen(showing.screenId())) {
                throw new SeatNotFoundException(seatId, showing.screenId());
            }
            seats.add(seat);
        }

        // 3. 가용성 검증 (하나라도 불가하면 아무것도 변경하지 않음)
        Set<Long> bookedSeatIds = bookingRepository.findActiveSeatIds(showing.id(), now);
        Map<Long, SeatReservation> liveHolds = availabilityResolver.liveHoldsBySeat(showing, now);
        List<SeatReservation> ownHolds = new ArrayList<>();
        for (Seat seat : seats) {
            if (!seat.isPhysicallyAvailable()) {
                throw unavailable(showing, seat, "seat is " + seat.status());
            }
            if (bookedSeatIds.contains(seat.id())) {
                throw unavailable(showing, seat, "already booked");
            }
            SeatReservation hold = liveHolds.get(seat.id());
            if (hold != null) {
                if (!hold.isOwnedBy(command.userId())) {
                    throw unavailable(showing, seat, "held by another user");
                }
                ownHolds.add(hold);
            }
        }

        // 4. 본인 홀드 소진
        ownHolds.forEach(hold -> seatReservationRepository.deleteById(hold.id()));

        // 5. 가격 스냅샷과 함께 예매 저장
        List<BookedSeat> bookedSeats = seats.stream()
                .map(seat -> BookedSeat.of(seat.id(), showing.priceFor(seat)))
                .toList();
        Booking booking = Booking.create(command.userId(), showing.id(), bookedSeats,
                command.notes(), now, ttl);
        Booking saved = bookingRepository.save(booking);

        record(saved, BookingAction.CREATED, BookingHistory.userActor(command.userId()), now,
                Map.of("seatIds", saved.seatIds().toString(),
                        "totalAmount", saved.totalAmount().toPlainString()));

        log.info("Booking created: bookingId={}, reference={}, seats={}, consumedHolds={}",
                saved.id(), saved.bookingReference(), saved.seatIds(), ownHolds.size());
        return saved;
    }

    /**
     * 트랜잭션 내에서 예매 확정
     * 결제 대기 시간이 지났으면 EXPIRED로 저장(커밋)한 뒤 BookingExpiredException을 던진다.
     */
    @Transactional(noRollbackFor = BookingExpiredException.class)
    public Booking confirmInTransaction(ConfirmBookingCommand command, LocalDateTime now) {
        Booking booking = loadOwnedForUpdate(command.bookingId(), command.userId());

        if (booking.isPastExpiry(now)) {
            Booking expired = booking.expire();
            bookingRepository.save(expired);
            record(expired, BookingAction.EXPIRED, BookingHistory.userActor(command.userId()), now,
                    Map.of("trigger", "confirm"));
            log.warn("Confirm attempted after expiry: bookingId={}, expiresAt={}",
                    booking.id(), booking.expiresAt());
            throw new BookingExpiredException(booking.id());
        }

        Booking confirmed = booking.confirm(command.paymentMethod(), command.paymentReference(), now);
        Booking saved = bookingRepository.save(confirmed);
        record(saved, BookingAction.CONFIRMED, BookingHistory.userActor(command.userId()), now,
                Map.of("paymentMethod", command.paymentMethod(),
                        "paymentReference", command.paymentReference()));

        log.info("Booking confirmed: bookingId={}, paymentMethod={}", saved.id(), saved.paymentMethod());
        return saved;
    }

    /**
     * 트랜잭션 내에서 예매 취소
     * 상영 시작 이후에는 상태와 무관하게 InvalidBookingTransitionException
     */
    @Transactional
    public Booking cancelInTransaction(CancelBookingCommand command, LocalDateTime now) {
        Booking booking = loadOwnedForUpdate(command.bookingId(), command.userId());

        Showing showing = showingRepository.findById(booking.showingId())
                .orElseThrow(() -> new ShowingNotFoundException(booking.showingId()));
        if (showing.hasStarted(now)) {
            throw new InvalidBookingTransitionException(booking.id(), booking.effectiveStatus(now),
                    BookingStatus.CANCELLED, "showing has already started");
        }

        Booking cancelled = booking.cancel(now);
        Booking saved = bookingRepository.save(cancelled);

        Map<String, String> metadata = new HashMap<>();
        metadata.put("previousStatus", booking.status().name());
        if (command.reason() != null) {
            metadata.put("reason", command.reason());
        }
        record(saved, BookingAction.CANCELLED, BookingHistory.userActor(command.userId()), now, metadata);

        log.info("Booking cancelled: bookingId={}, previousStatus={}", saved.id(), booking.status());
        return saved;
    }

    /**
     * 만료 처리 (스윕)
     * 이미 처리되었거나 아직 만료 전이면 아무것도 하지 않는다. (멱등)
     *
     * @return EXPIRED로 전환했으면 true
     */
    @Transactional
    public boolean expireBooking(Long bookingId, LocalDateTime now) {
        Booking booking = bookingRepository.findByIdForUpdate(bookingId).orElse(null);

        if (booking == null) {
            log.warn("Booking not found for expiration: bookingId={}", bookingId);
            return false;
        }
        if (!booking.isPastExpiry(now)) {
            log.debug("Booking no longer expirable: bookingId={}, status={}", bookingId, booking.status());
            return false;
        }

        Booking expired = booking.expire();
        bookingRepository.save(expired);
        record(expired, BookingAction.EXPIRED, BookingHistory.SYSTEM_SWEEPER, now, Map.of());

        log.info("Booking expired: bookingId={}", bookingId);
        return true;
    }

    private Booking loadOwnedForUpdate(Long bookingId, Long userId) {
        Booking booking = bookingRepository.findByIdForUpdate(bookingId)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
        booking.ensureOwnership(userId);
        return booking;
    }

    private void record(Booking booking, BookingAction action, String actor, LocalDateTime now,
                        Map<String, String> metadata) {
        BookingHistory history = bookingHistoryRepository.save(
                BookingHistory.of(booking.id(), action, actor, now, metadata));
        bookingEventPort.publishBookingEvent(booking, history);
    }

    private SeatUnavailableException unavailable(Showing showing, Seat seat, String reason) {
        log.warn("Seat not available for booking: showingId={}, seatId={}, reason={}",
                showing.id(), seat.id(), reason);
        return new SeatUnavailableException(showing.id(), seat.id(), reason);
    }
}
