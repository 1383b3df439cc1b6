package personal.cinema.core.booking.integration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import personal.cinema.core.booking.application.port.in.CancelBookingCommand;
import personal.cinema.core.booking.application.port.in.CancelBookingUseCase;
import personal.cinema.core.booking.application.port.in.ConfirmBookingCommand;
import personal.cinema.core.booking.application.port.in.ConfirmBookingUseCase;
import personal.cinema.core.booking.application.port.in.CreateBookingCommand;
import personal.cinema.core.booking.application.port.in.CreateBookingUseCase;
import personal.cinema.core.booking.application.port.in.ExtendHoldUseCase;
import personal.cinema.core.booking.application.port.in.GetAvailableSeatsUseCase;
import personal.cinema.core.booking.application.port.in.GetBookingUseCase;
import personal.cinema.core.booking.application.port.in.HoldSeatCommand;
import personal.cinema.core.booking.application.port.in.HoldSeatUseCase;
import personal.cinema.core.booking.application.port.in.ReleaseHoldUseCase;
import personal.cinema.core.booking.application.port.in.SweepExpiredUseCase;
import personal.cinema.core.booking.domain.exception.BookingExpiredException;
import personal.cinema.core.booking.domain.exception.InvalidBookingTransitionException;
import personal.cinema.core.booking.domain.exception.ReservationNotFoundException;
import personal.cinema.core.booking.domain.exception.SeatUnavailableException;
import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingAction;
import personal.cinema.core.booking.domain.model.BookingHistory;
import personal.cinema.core.booking.domain.model.BookingStatus;
import personal.cinema.core.booking.domain.model.SeatReservation;
import personal.cinema.core.support.BookingFixture;
import personal.cinema.core.support.MutableClock;
import personal.cinema.core.support.TestClockConfiguration;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 홀드/예매 수명 주기 통합 테스트 (H2, MutableClock)
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfiguration.class)
@DisplayName("홀드/예매 수명 주기 통합 테스트")
class BookingLifecycleIntegrationTest {

    private static final Long ALICE = 1L;
    private static final Long BOB = 2L;
    private static final LocalDateTime T0 = TestClockConfiguration.T0;

    @Autowired
    private HoldSeatUseCase holdSeatUseCase;

    @Autowired
    private ExtendHoldUseCase extendHoldUseCase;

    @Autowired
    private ReleaseHoldUseCase releaseHoldUseCase;

    @Autowired
    private CreateBookingUseCase createBookingUseCase;

    @Autowired
    private ConfirmBookingUseCase confirmBookingUseCase;

    @Autowired
    private CancelBookingUseCase cancelBookingUseCase;

    @Autowired
    private GetBookingUseCase getBookingUseCase;

    @Autowired
    private GetAvailableSeatsUseCase getAvailableSeatsUseCase;

    @Autowired
    private SweepExpiredUseCase sweepExpiredUseCase;

    @Autowired
    private BookingFixture fixture;

    @Autowired
    private MutableClock clock;

    private Long showingId;
    private List<Long> seatIds;

    @BeforeEach
    void setUp() {
        clock.setTo(T0);
        fixture.clearAllData();
        showingId = fixture.createShowing(T0.plusHours(2));
        seatIds = fixture.seatIds();
    }

    private HoldSeatCommand hold(Long userId, Long seatId) {
        return new HoldSeatCommand(userId, showingId, seatId, null);
    }

    private Booking book(Long userId, Long... seats) {
        return createBookingUseCase.createBooking(new CreateBookingCommand(userId, showingId, List.of(seats), null));
    }

    @Test
    @DisplayName("홀드는 15분 동안 좌석을 막고, 만료 후에는 다른 사용자가 홀드할 수 있다")
    void holdExpiry() {
        Long seat = seatIds.get(0);

        // given: t0에 Alice가 홀드
        holdSeatUseCase.holdSeat(hold(ALICE, seat));

        // when & then: t0+1m에 Bob은 실패
        clock.setTo(T0.plusMinutes(1));
        assertThatThrownBy(() -> holdSeatUseCase.holdSeat(hold(BOB, seat)))
                .isInstanceOf(SeatUnavailableException.class);

        // 만료 시각 정각까지는 여전히 막힌다
        clock.setTo(T0.plusMinutes(15));
        assertThat(getAvailableSeatsUseCase.getAvailableSeatIds(showingId)).doesNotContain(seat);

        // t0+16m에는 스윕 전이라도 Bob이 홀드할 수 있다
        clock.setTo(T0.plusMinutes(16));
        assertThat(getAvailableSeatsUseCase.getAvailableSeatIds(showingId)).contains(seat);
        SeatReservation bobHold = holdSeatUseCase.holdSeat(hold(BOB, seat));
        assertThat(bobHold.userId()).isEqualTo(BOB);
        assertThat(fixture.count("seat_reservations")).isEqualTo(1);
    }

    @Test
    @DisplayName("홀드 연장과 해제, 해제는 여러 번 호출해도 오류가 없다")
    void extendAndRelease() {
        // given
        Long seat = seatIds.get(0);
        SeatReservation held = holdSeatUseCase.holdSeat(hold(ALICE, seat));

        // when: 연장
        clock.setTo(T0.plusMinutes(10));
        SeatReservation extended = extendHoldUseCase.extendHold(held.id(), ALICE, 5);

        // then
        assertThat(extended.expiresAt()).isEqualTo(T0.plusMinutes(20));
        assertThatThrownBy(() -> extendHoldUseCase.extendHold(held.id(), BOB, 5))
                .isInstanceOf(ReservationNotFoundException.class);

        // when: 해제 (두 번)
        releaseHoldUseCase.releaseHold(held.id(), ALICE);
        assertThatCode(() -> releaseHoldUseCase.releaseHold(held.id(), ALICE)).doesNotThrowAnyException();
        assertThatCode(() -> releaseHoldUseCase.releaseHold(9999L, ALICE)).doesNotThrowAnyException();

        // then
        assertThat(getAvailableSeatsUseCase.getAvailableSeatIds(showingId)).contains(seat);
    }

    @Test
    @DisplayName("만료됐지만 아직 정리되지 않은 홀드는 다른 사용자가 해제해도 오류가 없다")
    void releaseExpiredHoldOfOtherUser() {
        // given
        Long seat = seatIds.get(0);
        SeatReservation held = holdSeatUseCase.holdSeat(hold(ALICE, seat));
        clock.setTo(T0.plusMinutes(16));

        // when & then
        assertThatCode(() -> releaseHoldUseCase.releaseHold(held.id(), BOB)).doesNotThrowAnyException();
        assertThat(fixture.count("seat_reservations")).isZero();
        assertThat(getAvailableSeatsUseCase.getAvailableSeatIds(showingId)).contains(seat);
    }

    @Test
    @DisplayName("예매 시 본인 홀드는 소진되고, 좌석은 예매로 계속 막힌다")
    void bookingConsumesOwnHold() {
        // given
        Long seat = seatIds.get(0);
        holdSeatUseCase.holdSeat(hold(ALICE, seat));

        // when
        Booking booking = book(ALICE, seat);

        // then
        assertThat(booking.status()).isEqualTo(BookingStatus.PENDING);
        assertThat(fixture.count("seat_reservations")).isZero();
        assertThatThrownBy(() -> holdSeatUseCase.holdSeat(hold(BOB, seat)))
                .isInstanceOf(SeatUnavailableException.class);
    }

    @Test
    @DisplayName("좌석 하나라도 이미 확정 예매되어 있으면 전체 요청이 실패하고 나머지 좌석도 남지 않는다")
    void bookingIsAllOrNothing() {
        // given: Bob이 Y를 확정
        Long x = seatIds.get(0);
        Long y = seatIds.get(1);
        Booking bobs = book(BOB, y);
        confirmBookingUseCase.confirmBooking(new ConfirmBookingCommand(bobs.id(), BOB, "CARD", "PAY-B"));

        // when & then
        assertThatThrownBy(() -> book(ALICE, x, y))
                .isInstanceOf(SeatUnavailableException.class)
                .hasMessageContaining("seatId=" + y);
        assertThat(getAvailableSeatsUseCase.getAvailableSeatIds(showingId)).contains(x).doesNotContain(y);
        assertThat(getBookingUseCase.getBookings(ALICE)).isEmpty();
    }

    @Test
    @DisplayName("좌석 가격은 등급 배수로 스냅샷되고 총액은 그 합이다")
    void priceSnapshot() {
        // B행은 VIP
        Booking booking = book(ALICE, seatIds.get(0), seatIds.get(5));

        assertThat(booking.seats()).extracting(seat -> seat.pricePaid().toPlainString())
                .containsExactly("10.00", "15.00");
        assertThat(booking.totalAmount()).isEqualByComparingTo("25.00");
    }

    @Test
    @DisplayName("만료 후 확정하면 EXPIRED가 커밋되고 BookingExpired가 발생한다")
    void confirmAfterExpiry() {
        // given
        Booking booking = book(ALICE, seatIds.get(0));
        clock.advance(Duration.ofMinutes(16));

        // when & then
        ConfirmBookingCommand confirm = new ConfirmBookingCommand(booking.id(), ALICE, "CARD", "PAY-1");
        assertThatThrownBy(() -> confirmBookingUseCase.confirmBooking(confirm))
                .isInstanceOf(BookingExpiredException.class);

        assertThat(getBookingUseCase.getBooking(booking.id(), ALICE).status()).isEqualTo(BookingStatus.EXPIRED);
        assertThat(getBookingUseCase.getHistory(booking.id(), ALICE))
                .extracting(BookingHistory::action)
                .containsExactly(BookingAction.CREATED, BookingAction.EXPIRED);
        assertThat(fixture.outboxEventTypes(booking.id()))
                .containsExactly("BOOKING_CREATED", "BOOKING_EXPIRED");
        assertThat(getAvailableSeatsUseCase.getAvailableSeatIds(showingId)).contains(seatIds.get(0));
    }

    @Test
    @DisplayName("두 번 확정하면 InvalidTransition이 발생한다")
    void confirmTwice() {
        // given
        Booking booking = book(ALICE, seatIds.get(0));
        ConfirmBookingCommand confirm = new ConfirmBookingCommand(booking.id(), ALICE, "CARD", "PAY-1");
        confirmBookingUseCase.confirmBooking(confirm);

        // when & then
        assertThatThrownBy(() -> confirmBookingUseCase.confirmBooking(confirm))
                .isInstanceOf(InvalidBookingTransitionException.class);
    }

    @Test
    @DisplayName("상영 시작 후 확정은 허용되지만 취소는 InvalidTransition이다")
    void afterShowStart() {
        // given: 상영 시작 5분 전에 예매
        clock.setTo(T0.plusHours(2).minusMinutes(5));
        Booking booking = book(ALICE, seatIds.get(0));

        // when: 상영 시작 3분 후 확정
        clock.setTo(T0.plusHours(2).plusMinutes(3));
        Booking confirmed = confirmBookingUseCase.confirmBooking(
                new ConfirmBookingCommand(booking.id(), ALICE, "CARD", "PAY-1"));

        // then
        assertThat(confirmed.status()).isEqualTo(BookingStatus.CONFIRMED);
        assertThatThrownBy(() -> cancelBookingUseCase.cancelBooking(
                new CancelBookingCommand(booking.id(), ALICE, "too late")))
                .isInstanceOf(InvalidBookingTransitionException.class);
    }

    @Test
    @DisplayName("확정 예매를 취소하면 좌석이 다시 가용해지고 사유가 이력에 남는다")
    void cancelReleasesSeats() {
        // given
        Booking booking = book(ALICE, seatIds.get(0));
        confirmBookingUseCase.confirmBooking(new ConfirmBookingCommand(booking.id(), ALICE, "CARD", "PAY-1"));

        // when
        Booking cancelled = cancelBookingUseCase.cancelBooking(
                new CancelBookingCommand(booking.id(), ALICE, "changed plans"));

        // then
        assertThat(cancelled.status()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(getAvailableSeatsUseCase.getAvailableSeatIds(showingId)).contains(seatIds.get(0));
        List<BookingHistory> history = getBookingUseCase.getHistory(booking.id(), ALICE);
        assertThat(history).extracting(BookingHistory::action)
                .containsExactly(BookingAction.CREATED, BookingAction.CONFIRMED, BookingAction.CANCELLED);
        assertThat(history.get(2).metadata()).containsEntry("reason", "changed plans");
    }

    @Test
    @DisplayName("스윕은 만료된 홀드를 삭제하고 만료된 PENDING 예매를 EXPIRED로 전환한다")
    void sweep() {
        // given
        holdSeatUseCase.holdSeat(hold(BOB, seatIds.get(1)));
        Booking booking = book(ALICE, seatIds.get(0));
        clock.advance(Duration.ofMinutes(20));

        // when
        int holds = sweepExpiredUseCase.sweepExpiredHolds();
        int bookings = sweepExpiredUseCase.sweepExpiredBookings();

        // then
        assertThat(holds).isEqualTo(1);
        assertThat(bookings).isEqualTo(1);
        assertThat(fixture.count("seat_reservations")).isZero();
        List<BookingHistory> history = getBookingUseCase.getHistory(booking.id(), ALICE);
        assertThat(history).last()
                .satisfies(entry -> {
                    assertThat(entry.action()).isEqualTo(BookingAction.EXPIRED);
                    assertThat(entry.actor()).isEqualTo(BookingHistory.SYSTEM_SWEEPER);
                });

        // 두 번째 스윕은 아무것도 하지 않는다
        assertThat(sweepExpiredUseCase.sweepExpiredBookings()).isZero();
    }

    @Test
    @DisplayName("판매 차단된 좌석은 가용 목록에 없고 홀드할 수 없다")
    void blockedSeat() {
        // given
        Long seat = seatIds.get(0);
        fixture.updateSeatStatus(seat, "BLOCKED");

        // when & then
        assertThat(getAvailableSeatsUseCase.getAvailableSeatIds(showingId)).doesNotContain(seat);
        assertThatThrownBy(() -> holdSeatUseCase.holdSeat(hold(ALICE, seat)))
                .isInstanceOf(SeatUnavailableException.class);
    }
}
