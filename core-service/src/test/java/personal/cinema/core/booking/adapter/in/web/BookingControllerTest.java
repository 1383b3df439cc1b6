package personal.cinema.core.booking.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.cinema.core.booking.application.port.in.CancelBookingCommand;
import personal.cinema.core.booking.application.port.in.CancelBookingUseCase;
import personal.cinema.core.booking.application.port.in.ConfirmBookingCommand;
import personal.cinema.core.booking.application.port.in.ConfirmBookingUseCase;
import personal.cinema.core.booking.application.port.in.CreateBookingCommand;
import personal.cinema.core.booking.application.port.in.CreateBookingUseCase;
import personal.cinema.core.booking.application.port.in.GetBookingUseCase;
import personal.cinema.core.booking.domain.exception.BookingExpiredException;
import personal.cinema.core.booking.domain.exception.InvalidBookingTransitionException;
import personal.cinema.core.booking.domain.model.BookedSeat;
import personal.cinema.core.booking.domain.model.Booking;
import personal.cinema.core.booking.domain.model.BookingAction;
import personal.cinema.core.booking.domain.model.BookingHistory;
import personal.cinema.core.booking.domain.model.BookingStatus;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(BookingController.class)
@DisplayName("Booking API 단위 테스트")
class BookingControllerTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 1, 18, 0);

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CreateBookingUseCase createBookingUseCase;

    @MockBean
    private ConfirmBookingUseCase confirmBookingUseCase;

    @MockBean
    private CancelBookingUseCase cancelBookingUseCase;

    @MockBean
    private GetBookingUseCase getBookingUseCase;

    private Booking pendingBooking() {
        Booking created = Booking.create(1L, 10L,
                List.of(BookedSeat.of(100L, new BigDecimal("10.00")), BookedSeat.of(101L, new BigDecimal("15.00"))),
                null, NOW, Duration.ofMinutes(15));
        return new Booking(7L, created.bookingReference(), 1L, 10L, created.totalAmount(), created.status(),
                created.bookedAt(), created.expiresAt(), null, null, null, null, null, created.seats());
    }

    @Test
    @DisplayName("예매 생성에 성공하면 201과 PENDING 상태, 좌석별 가격을 반환한다")
    void createBooking_Created() throws Exception {
        // given
        given(createBookingUseCase.createBooking(any(CreateBookingCommand.class))).willReturn(pendingBooking());

        // when & then
        mockMvc.perform(post("/api/v1/bookings")
                        .header("X-User-Id", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"showingId\":10,\"seatIds\":[100,101]}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.bookingId").value(7))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.totalAmount").value(25.00))
                .andExpect(jsonPath("$.seats.length()").value(2));
    }

    @Test
    @DisplayName("좌석 목록이 비어 있으면 400을 반환한다")
    void createBooking_EmptySeats() throws Exception {
        mockMvc.perform(post("/api/v1/bookings")
                        .header("X-User-Id", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"showingId\":10,\"seatIds\":[]}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("좌석 목록에 중복이 있으면 400을 반환한다")
    void createBooking_DuplicateSeats() throws Exception {
        mockMvc.perform(post("/api/v1/bookings")
                        .header("X-User-Id", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"showingId\":10,\"seatIds\":[100,100]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("결제 대기 시간이 지난 예매를 확정하면 409와 B005 코드를 반환한다")
    void confirmBooking_Expired() throws Exception {
        // given
        given(confirmBookingUseCase.confirmBooking(any(ConfirmBookingCommand.class)))
                .willThrow(new BookingExpiredException(7L));

        // when & then
        mockMvc.perform(post("/api/v1/bookings/7/confirm")
                        .header("X-User-Id", 1L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paymentMethod\":\"CARD\",\"paymentReference\":\"PAY-1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("B005"));
    }

    @Test
    @DisplayName("상영 시작 후 취소하면 409와 B007 코드를 반환한다")
    void cancelBooking_AfterStart() throws Exception {
        // given
        given(cancelBookingUseCase.cancelBooking(any(CancelBookingCommand.class)))
                .willThrow(new InvalidBookingTransitionException(7L, BookingStatus.CONFIRMED,
                        BookingStatus.CANCELLED, "showing has already started"));

        // when & then
        mockMvc.perform(post("/api/v1/bookings/7/cancel").header("X-User-Id", 1L))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("B007"));
    }

    @Test
    @DisplayName("예매 이력은 발생 순서대로 반환한다")
    void getHistory() throws Exception {
        // given
        given(getBookingUseCase.getHistory(7L, 1L)).willReturn(List.of(
                new BookingHistory(1L, 7L, BookingAction.CREATED, "user:1", NOW, Map.of()),
                new BookingHistory(2L, 7L, BookingAction.CONFIRMED, "user:1", NOW.plusMinutes(3),
                        Map.of("paymentMethod", "CARD"))));

        // when & then
        mockMvc.perform(get("/api/v1/bookings/7/history").header("X-User-Id", 1L))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].action").value("CREATED"))
                .andExpect(jsonPath("$[1].action").value("CONFIRMED"));
    }
}
