package personal.cinema.core.booking.adapter.out.redis;

import lombok.extern.slf4j.Slf4j;
import personal.cinema.core.booking.application.port.out.SeatLockRepository;

/**
 * NoSeatLock Adapter
 * 선점 락 없이 DB 락과 유니크 제약만으로 동시성을 처리한다.
 *
 * 사용 환경:
 * - 로컬 개발, 테스트
 * - Redis 없이 운영하는 단일 DB 배포
 */
@Slf4j
public class NoSeatLockAdapter implements SeatLockRepository {

    @Override
    public boolean tryLock(Long showingId, Long seatId, Long userId) {
        return true;
    }

    @Override
    public void unlock(Long showingId, Long seatId, Long userId) {
        // No-op
    }
}
