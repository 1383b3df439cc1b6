package personal.cinema.core.booking.application.port.in;

import personal.cinema.core.booking.domain.model.SeatReservation;

import java.util.List;

/**
 * Get Holds UseCase (Input Port)
 */
public interface GetHoldsUseCase {

    /**
     * 사용자의 살아있는 홀드 목록 조회
     */
    List<SeatReservation> getActiveHolds(Long userId);
}
