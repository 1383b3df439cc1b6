package personal.cinema.core.booking.application.port.in;

import personal.cinema.core.booking.domain.model.SeatAvailability;

import java.util.List;

/**
 * Get Available Seats UseCase (Input Port)
 * 상영별 구매 가능 좌석 조회 유스케이스
 */
public interface GetAvailableSeatsUseCase {

    /**
     * 현재 구매 가능한 좌석 ID 목록
     *
     * @param showingId 상영 ID
     * @return 좌석 ID 오름차순
     * @throws personal.cinema.core.booking.domain.exception.ShowingNotFoundException 상영을 찾을 수 없을 때
     */
    List<Long> getAvailableSeatIds(Long showingId);

    /**
     * 상영의 전체 좌석 현황 (좌석 배치도용)
     */
    List<SeatAvailability> getSeatMap(Long showingId);
}
