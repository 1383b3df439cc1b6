package personal.cinema.core.booking.application.port.in;

import personal.cinema.core.booking.domain.model.SeatReservation;

/**
 * Hold Seat UseCase (Input Port)
 * 좌석 임시 홀드 유스케이스
 */
public interface HoldSeatUseCase {

    /**
     * 좌석 홀드
     * (showing, seat) 당 살아있는 홀드는 하나뿐이며, 경쟁에서 진 요청은 SeatUnavailable을 받는다.
     *
     * @param command 홀드 커맨드 (userId, showingId, seatId, sessionId)
     * @return 생성된 홀드 (expiresAt = now + TTL)
     * @throws personal.cinema.core.booking.domain.exception.SeatUnavailableException 이미 홀드/예매된 좌석이거나 판매 불가 좌석일 때
     * @throws personal.cinema.core.booking.domain.exception.ShowingNotFoundException 상영을 찾을 수 없을 때
     * @throws personal.cinema.core.booking.domain.exception.SeatNotFoundException 좌석이 없거나 상영관에 속하지 않을 때
     */
    SeatReservation holdSeat(HoldSeatCommand command);
}
