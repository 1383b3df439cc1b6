package personal.cinema.core.booking.application.port.out;

import personal.cinema.core.booking.domain.model.Seat;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Seat Repository (Output Port)
 * 좌석 카탈로그 저장소 인터페이스
 */
public interface SeatRepository {

    /**
     * 좌석 ID로 조회
     *
     * @param seatId 좌석 ID
     * @return 좌석 정보
     */
    Optional<Seat> findById(Long seatId);

    /**
     * 좌석 ID 목록으로 조회 (존재하는 좌석만 반환)
     */
    List<Seat> findAllById(Collection<Long> seatIds);

    /**
     * 상영관의 전체 좌석 조회 (행, 번호 순)
     *
     * @param screenId 상영관 ID
     * @return 좌석 목록
     */
    List<Seat> findByScreenId(Long screenId);

    /**
     * 좌석 일괄 저장 (카탈로그 초기화용)
     */
    List<Seat> saveAll(List<Seat> seats);
}
