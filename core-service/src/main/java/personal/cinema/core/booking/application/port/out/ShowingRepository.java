package personal.cinema.core.booking.application.port.out;

import personal.cinema.core.booking.domain.model.Showing;

import java.util.List;
import java.util.Optional;

/**
 * Showing Repository (Output Port)
 * 상영 일정 저장소 인터페이스
 */
public interface ShowingRepository {

    Optional<Showing> findById(Long showingId);

    /**
     * 상영 조회 + 비관적 쓰기 락 (SELECT ... FOR UPDATE)
     * 같은 상영에 대한 홀드/예매 생성을 트랜잭션 단위로 직렬화한다.
     * 반드시 트랜잭션 안에서 호출해야 한다.
     *
     * @param showingId 상영 ID
     * @return 락이 걸린 상영 정보
     */
    Optional<Showing> findByIdForUpdate(Long showingId);

    /**
     * 상영관의 상영 일정 조회 (겹침 검증용)
     */
    List<Showing> findByScreenId(Long screenId);

    Showing save(Showing showing);
}
