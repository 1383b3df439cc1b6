package personal.cinema.core.booking.application.port.in;

import personal.cinema.core.booking.domain.model.SeatReservation;

/**
 * Extend Hold UseCase (Input Port)
 */
public interface ExtendHoldUseCase {

    /**
     * 홀드 만료 시각 연장
     *
     * @param reservationId 홀드 ID
     * @param userId        사용자 ID (소유권 검증용)
     * @param minutes       연장할 시간(분), null이면 기본값
     * @return 연장된 홀드
     * @throws personal.cinema.core.booking.domain.exception.ReservationNotFoundException 없거나, 타인 소유이거나, 이미 만료된 경우
     */
    SeatReservation extendHold(Long reservationId, Long userId, Integer minutes);
}
