package personal.cinema.core.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.cinema.core.booking.adapter.in.web.dto.BookingHistoryResponse;
import personal.cinema.core.booking.adapter.in.web.dto.BookingResponse;
import personal.cinema.core.booking.adapter.in.web.dto.CancelBookingRequest;
import personal.cinema.core.booking.adapter.in.web.dto.ConfirmBookingRequest;
import personal.cinema.core.booking.adapter.in.web.dto.CreateBookingRequest;
import personal.cinema.core.booking.application.port.in.CancelBookingCommand;
import personal.cinema.core.booking.application.port.in.CancelBookingUseCase;
import personal.cinema.core.booking.application.port.in.ConfirmBookingUseCase;
import personal.cinema.core.booking.application.port.in.CreateBookingUseCase;
import personal.cinema.core.booking.application.port.in.GetBookingUseCase;
import personal.cinema.core.booking.domain.model.Booking;

import java.util.List;

/**
 * Booking API Controller
 * 예매 생성/확정/취소/조회 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/bookings")
@RequiredArgsConstructor
public class BookingController {

    private final CreateBookingUseCase createBookingUseCase;
    private final ConfirmBookingUseCase confirmBookingUseCase;
    private final CancelBookingUseCase cancelBookingUseCase;
    private final GetBookingUseCase getBookingUseCase;

    /**
     * 예매 생성 (PENDING)
     * POST /api/v1/bookings
     */
    @PostMapping
    public ResponseEntity<BookingResponse> createBooking(
            @Valid @RequestBody CreateBookingRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Create booking: userId={}, showingId={}, seatIds={}",
                userId, request.showingId(), request.seatIds());

        Booking booking = createBookingUseCase.createBooking(request.toCommand(userId));

        return ResponseEntity.status(HttpStatus.CREATED).body(BookingResponse.from(booking));
    }

    /**
     * 예매 확정 (결제 완료)
     * POST /api/v1/bookings/{bookingId}/confirm
     */
    @PostMapping("/{bookingId}/confirm")
    public ResponseEntity<BookingResponse> confirmBooking(
            @PathVariable Long bookingId,
            @Valid @RequestBody ConfirmBookingRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Confirm booking: bookingId={}, userId={}", bookingId, userId);

        Booking booking = confirmBookingUseCase.confirmBooking(request.toCommand(bookingId, userId));

        return ResponseEntity.ok(BookingResponse.from(booking));
    }

    /**
     * 예매 취소
     * POST /api/v1/bookings/{bookingId}/cancel
     */
    @PostMapping("/{bookingId}/cancel")
    public ResponseEntity<BookingResponse> cancelBooking(
            @PathVariable Long bookingId,
            @Valid @RequestBody(required = false) CancelBookingRequest request,
            @RequestHeader("X-User-Id") Long userId
    ) {
        log.info("Cancel booking: bookingId={}, userId={}", bookingId, userId);

        CancelBookingCommand command = request != null
                ? request.toCommand(bookingId, userId)
                : new CancelBookingCommand(bookingId, userId, null);
        Booking booking = cancelBookingUseCase.cancelBooking(command);

        return ResponseEntity.ok(BookingResponse.from(booking));
    }

    /**
     * 예매 조회
     * GET /api/v1/bookings/{bookingId}
     */
    @GetMapping("/{bookingId}")
    public ResponseEntity<BookingResponse> getBooking(
            @PathVariable Long bookingId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        return ResponseEntity.ok(BookingResponse.from(getBookingUseCase.getBooking(bookingId, userId)));
    }

    /**
     * 내 예매 목록 (최신순)
     * GET /api/v1/bookings
     */
    @GetMapping
    public ResponseEntity<List<BookingResponse>> getBookings(@RequestHeader("X-User-Id") Long userId) {
        List<BookingResponse> response = getBookingUseCase.getBookings(userId).stream()
                .map(BookingResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    /**
     * 예매 감사 로그
     * GET /api/v1/bookings/{bookingId}/history
     */
    @GetMapping("/{bookingId}/history")
    public ResponseEntity<List<BookingHistoryResponse>> getHistory(
            @PathVariable Long bookingId,
            @RequestHeader("X-User-Id") Long userId
    ) {
        List<BookingHistoryResponse> response = getBookingUseCase.getHistory(bookingId, userId).stream()
                .map(BookingHistoryResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }
}
