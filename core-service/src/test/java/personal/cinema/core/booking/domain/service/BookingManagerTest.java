package personal.cinema.core.booking.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
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
import personal.cinema.core.booking.domain.model.BookedSeat;
import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingAction;
import personal.cinema.core.booking.domain.model.BookingHistory;
import personal.cinema.core.booking.domain.model.BookingStatus;
import personal.cinema.core.booking.domain.model.Seat;
import personal.cinema.core.booking.domain.model.SeatReservation;
import personal.cinema.core.booking.domain.model.SeatStatus;
import personal.cinema.core.booking.domain.model.SeatType;
import personal.cinema.core.booking.domain.model.Showing;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("BookingManager 단위 테스트")
class BookingManagerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 18, 0);
    private static final Duration TTL = Duration.ofMinutes(15);

    @Mock
    private ShowingRepository showingRepository;

    @Mock
    private SeatRepository seatRepository;

    @Mock
    private SeatReservationRepository seatReservationRepository;

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private BookingHistoryRepository bookingHistoryRepository;

    @Mock
    private BookingEventPort bookingEventPort;

    @Mock
    private AvailabilityResolver availabilityResolver;

    @InjectMocks
    private BookingManager bookingManager;

    private final Showing showing = new Showing(10L, 7L, 1L, NOW.plusHours(2), NOW.plusHours(4), new BigDecimal("10.00"));
    private final Seat standard = seat(100L, SeatType.STANDARD, SeatStatus.AVAILABLE);
    private final Seat vip = seat(101L, SeatType.VIP, SeatStatus.AVAILABLE);

    private static Seat seat(Long id, SeatType type, SeatStatus status) {
        return new Seat(id, 1L, "A", id.intValue() - 99, type, status, false, false, id.intValue(), 1);
    }

    private static Booking withId(Booking booking, Long id) {
        return new Booking(id, booking.bookingReference(), booking.userId(), booking.showingId(),
                booking.totalAmount(), booking.status(), booking.bookedAt(), booking.expiresAt(),
                booking.confirmedAt(), booking.cancelledAt(), booking.paymentMethod(),
                booking.paymentReference(), booking.notes(), booking.seats());
    }

    private Booking pendingBooking() {
        return withId(Booking.create(1L, 10L, List.of(BookedSeat.of(100L, new BigDecimal("10.00"))),
                null, NOW, TTL), 7L);
    }

    private void givenHistorySaved() {
        given(bookingHistoryRepository.save(any(BookingHistory.class)))
                .willAnswer(invocation -> invocation.getArgument(0));
    }

    @Nested
    @DisplayName("예매 생성")
    class CreateBooking {

        private final CreateBookingCommand command = new CreateBookingCommand(1L, 10L, List.of(100L, 101L), null);

        private void givenShowingAndSeats() {
            given(showingRepository.findByIdForUpdate(10L)).willReturn(Optional.of(showing));
            given(seatRepository.findAllById(command.seatIds())).willReturn(List.of(standard, vip));
        }

        @Test
        @DisplayName("모든 좌석이 가용하면 가격 스냅샷과 함께 PENDING 예매를 저장하고 이력과 이벤트를 남긴다")
        void createBooking_Success() {
            // given
            givenShowingAndSeats();
            given(bookingRepository.findActiveSeatIds(10L, NOW)).willReturn(Set.of());
            given(availabilityResolver.liveHoldsBySeat(showing, NOW)).willReturn(Map.of());
            given(bookingRepository.save(any(Booking.class)))
                    .willAnswer(invocation -> withId(invocation.getArgument(0), 7L));
            givenHistorySaved();

            // when
            Booking booking = bookingManager.createBookingInTransaction(command, NOW, TTL);

            // then
            assertThat(booking.id()).isEqualTo(7L);
            assertThat(booking.status()).isEqualTo(BookingStatus.PENDING);
            assertThat(booking.totalAmount()).isEqualByComparingTo("25.00");
            assertThat(booking.expiresAt()).isEqualTo(NOW.plusMinutes(15));

            ArgumentCaptor<BookingHistory> history = ArgumentCaptor.forClass(BookingHistory.class);
            verify(bookingHistoryRepository).save(history.capture());
            assertThat(history.getValue().action()).isEqualTo(BookingAction.CREATED);
            assertThat(history.getValue().actor()).isEqualTo("user:1");
            verify(bookingEventPort).publishBookingEvent(any(Booking.class), any(BookingHistory.class));
        }

        @Test
        @DisplayName("요청자 본인의 홀드는 예매로 전환되며 삭제된다")
        void createBooking_ConsumesOwnHold() {
            // given
            SeatReservation ownHold = new SeatReservation(5L, 1L, 10L, 100L, null, NOW, NOW.plusMinutes(10));
            givenShowingAndSeats();
            given(bookingRepository.findActiveSeatIds(10L, NOW)).willReturn(Set.of());
            given(availabilityResolver.liveHoldsBySeat(showing, NOW)).willReturn(Map.of(100L, ownHold));
            given(bookingRepository.save(any(Booking.class)))
                    .willAnswer(invocation -> withId(invocation.getArgument(0), 7L));
            givenHistorySaved();

            // when
            bookingManager.createBookingInTransaction(command, NOW, TTL);

            // then
            verify(seatReservationRepository).deleteById(5L);
        }

        @Test
        @DisplayName("좌석 하나라도 다른 사용자가 홀드 중이면 아무것도 저장하지 않는다")
        void createBooking_HeldByOther() {
            // given
            SeatReservation otherHold = new SeatReservation(5L, 2L, 10L, 101L, null, NOW, NOW.plusMinutes(10));
            givenShowingAndSeats();
            given(bookingRepository.findActiveSeatIds(10L, NOW)).willReturn(Set.of());
            given(availabilityResolver.liveHoldsBySeat(showing, NOW)).willReturn(Map.of(101L, otherHold));

            // when & then
            assertThatThrownBy(() -> bookingManager.createBookingInTransaction(command, NOW, TTL))
                    .isInstanceOf(SeatUnavailableException.class)
                    .hasMessageContaining("seatId=101");
            verify(bookingRepository, never()).save(any());
            verify(seatReservationRepository, never()).deleteById(any());
        }

        @Test
        @DisplayName("이미 예매된 좌석이 포함되면 SeatUnavailableException이 발생한다")
        void createBooking_AlreadyBooked() {
            // given
            givenShowingAndSeats();
            given(bookingRepository.findActiveSeatIds(10L, NOW)).willReturn(Set.of(100L));
            given(availabilityResolver.liveHoldsBySeat(showing, NOW)).willReturn(Map.of());

            // when & then
            assertThatThrownBy(() -> bookingManager.createBookingInTransaction(command, NOW, TTL))
                    .isInstanceOf(SeatUnavailableException.class);
            verify(bookingRepository, never()).save(any());
        }

        @Test
        @DisplayName("판매 차단된 좌석이 포함되면 SeatUnavailableException이 발생한다")
        void createBooking_BlockedSeat() {
            // given
            given(showingRepository.findByIdForUpdate(10L)).willReturn(Optional.of(showing));
            given(seatRepository.findAllById(command.seatIds()))
                    .willReturn(List.of(standard, seat(101L, SeatType.VIP, SeatStatus.BLOCKED)));
            given(bookingRepository.findActiveSeatIds(10L, NOW)).willReturn(Set.of());
            given(availabilityResolver.liveHoldsBySeat(showing, NOW)).willReturn(Map.of());

            // when & then
            assertThatThrownBy(() -> bookingManager.createBookingInTransaction(command, NOW, TTL))
                    .isInstanceOf(SeatUnavailableException.class);
        }

        @Test
        @DisplayName("존재하지 않는 좌석이 포함되면 SeatNotFoundException이 발생한다")
        void createBooking_UnknownSeat() {
            // given
            given(showingRepository.findByIdForUpdate(10L)).willReturn(Optional.of(showing));
            given(seatRepository.findAllById(command.seatIds())).willReturn(List.of(standard));

            // when & then
            assertThatThrownBy(() -> bookingManager.createBookingInTransaction(command, NOW, TTL))
                    .isInstanceOf(SeatNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("예매 확정")
    class ConfirmBooking {

        private final ConfirmBookingCommand command = new ConfirmBookingCommand(7L, 1L, "CARD", "PAY-1");

        @Test
        @DisplayName("만료 전이면 CONFIRMED로 저장하고 결제 정보를 이력에 남긴다")
        void confirm_Success() {
            // given
            given(bookingRepository.findByIdForUpdate(7L)).willReturn(Optional.of(pendingBooking()));
            given(bookingRepository.save(any(Booking.class))).willAnswer(invocation -> invocation.getArgument(0));
            givenHistorySaved();

            // when
            Booking confirmed = bookingManager.confirmInTransaction(command, NOW.plusMinutes(5));

            // then
            assertThat(confirmed.status()).isEqualTo(BookingStatus.CONFIRMED);
            ArgumentCaptor<BookingHistory> history = ArgumentCaptor.forClass(BookingHistory.class);
            verify(bookingHistoryRepository).save(history.capture());
            assertThat(history.getValue().action()).isEqualTo(BookingAction.CONFIRMED);
            assertThat(history.getValue().metadata()).containsEntry("paymentReference", "PAY-1");
        }

        @Test
        @DisplayName("만료 시각이 지났으면 EXPIRED를 저장한 뒤 BookingExpiredException이 발생한다")
        void confirm_AfterExpiry() {
            // given
            given(bookingRepository.findByIdForUpdate(7L)).willReturn(Optional.of(pendingBooking()));
            given(bookingRepository.save(any(Booking.class))).willAnswer(invocation -> invocation.getArgument(0));
            givenHistorySaved();

            // when & then
            assertThatThrownBy(() -> bookingManager.confirmInTransaction(command, NOW.plusMinutes(16)))
                    .isInstanceOf(BookingExpiredException.class);

            ArgumentCaptor<Booking> saved = ArgumentCaptor.forClass(Booking.class);
            verify(bookingRepository).save(saved.capture());
            assertThat(saved.getValue().status()).isEqualTo(BookingStatus.EXPIRED);
        }

        @Test
        @DisplayName("다른 사용자의 예매는 BookingNotFoundException이 발생한다")
        void confirm_OtherUser() {
            given(bookingRepository.findByIdForUpdate(7L)).willReturn(Optional.of(pendingBooking()));

            assertThatThrownBy(() -> bookingManager.confirmInTransaction(
                    new ConfirmBookingCommand(7L, 2L, "CARD", "PAY-1"), NOW))
                    .isInstanceOf(BookingNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("예매 취소")
    class CancelBooking {

        @Test
        @DisplayName("상영 시작 전이면 취소하고 이전 상태와 사유를 이력에 남긴다")
        void cancel_Success() {
            // given
            given(bookingRepository.findByIdForUpdate(7L)).willReturn(Optional.of(pendingBooking()));
            given(showingRepository.findById(10L)).willReturn(Optional.of(showing));
            given(bookingRepository.save(any(Booking.class))).willAnswer(invocation -> invocation.getArgument(0));
            givenHistorySaved();

            // when
            Booking cancelled = bookingManager.cancelInTransaction(
                    new CancelBookingCommand(7L, 1L, "changed plans"), NOW.plusMinutes(1));

            // then
            assertThat(cancelled.status()).isEqualTo(BookingStatus.CANCELLED);
            ArgumentCaptor<BookingHistory> history = ArgumentCaptor.forClass(BookingHistory.class);
            verify(bookingHistoryRepository).save(history.capture());
            assertThat(history.getValue().metadata())
                    .containsEntry("previousStatus", "PENDING")
                    .containsEntry("reason", "changed plans");
        }

        @Test
        @DisplayName("상영이 시작된 뒤에는 InvalidBookingTransitionException이 발생한다")
        void cancel_AfterShowStarted() {
            // given
            given(bookingRepository.findByIdForUpdate(7L)).willReturn(Optional.of(pendingBooking()));
            given(showingRepository.findById(10L)).willReturn(Optional.of(showing));

            // when & then
            assertThatThrownBy(() -> bookingManager.cancelInTransaction(
                    new CancelBookingCommand(7L, 1L, null), showing.startTime()))
                    .isInstanceOf(InvalidBookingTransitionException.class)
                    .hasMessageContaining("showing has already started");
            verify(bookingRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("만료 처리")
    class ExpireBooking {

        @Test
        @DisplayName("만료 시각이 지난 PENDING 예매를 시스템 행위자로 EXPIRED 처리한다")
        void expire_Success() {
            // given
            given(bookingRepository.findByIdForUpdate(7L)).willReturn(Optional.of(pendingBooking()));
            given(bookingRepository.save(any(Booking.class))).willAnswer(invocation -> invocation.getArgument(0));
            givenHistorySaved();

            // when
            boolean expired = bookingManager.expireBooking(7L, NOW.plusMinutes(16));

            // then
            assertThat(expired).isTrue();
            ArgumentCaptor<BookingHistory> history = ArgumentCaptor.forClass(BookingHistory.class);
            verify(bookingHistoryRepository).save(history.capture());
            assertThat(history.getValue().actor()).isEqualTo(BookingHistory.SYSTEM_SWEEPER);
        }

        @Test
        @DisplayName("그 사이 확정된 예매는 건너뛴다")
        void expire_AlreadyConfirmed() {
            // given
            Booking confirmed = pendingBooking().confirm("CARD", "PAY-1", NOW.plusMinutes(1));
            given(bookingRepository.findByIdForUpdate(7L)).willReturn(Optional.of(confirmed));

            // when & then
            assertThat(bookingManager.expireBooking(7L, NOW.plusMinutes(16))).isFalse();
            verify(bookingRepository, never()).save(any());
        }
    }
}
