package personal.cinema.core.booking.adapter.out.redis;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import personal.cinema.core.booking.application.port.out.SeatLockRepository;

import java.time.Duration;
import java.util.Collections;

/**
 * Redis Seat Lock Adapter
 * Redis SETNX 기반 좌석 선점 구현체
 * Lua Script를 사용한 원자적 락 해제 (소유권 검증)
 *
 * 락은 DB 트랜잭션 앞단의 필터일 뿐이며, 정합성은 DB 락과 유니크 제약이 보장한다.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisSeatLockAdapter implements SeatLockRepository {

    private static final String SEAT_LOCK_PREFIX = "seat:lock:";

    private final StringRedisTemplate redisTemplate;
    private final RedisScript<Long> releaseLockScript;
    private final Duration lockTtl;

    @Override
    public boolean tryLock(Long showingId, Long seatId, Long userId) {
        String key = buildKey(showingId, seatId);

        // SETNX + TTL을 원자적으로 수행 (setIfAbsent)
        Boolean success = redisTemplate.opsForValue()
                .setIfAbsent(key, String.valueOf(userId), lockTtl);

        boolean locked = Boolean.TRUE.equals(success);
        log.debug("Seat lock attempt: showingId={}, seatId={}, userId={}, success={}",
                showingId, seatId, userId, locked);
        return locked;
    }

    @Override
    public void unlock(Long showingId, Long seatId, Long userId) {
        String key = buildKey(showingId, seatId);

        try {
            Long result = redisTemplate.execute(
                    releaseLockScript,
                    Collections.singletonList(key),
                    String.valueOf(userId));

            if (result != null && result == 1L) {
                log.debug("Seat lock released: showingId={}, seatId={}", showingId, seatId);
            } else {
                log.warn("Seat lock not released (not owned or already expired): showingId={}, seatId={}, userId={}",
                        showingId, seatId, userId);
            }
        } catch (DataAccessException e) {
            // 해제 실패 시 TTL로 자동 해제된다.
            log.error("Error releasing seat lock: showingId={}, seatId={}, userId={}", showingId, seatId, userId, e);
        }
    }

    private String buildKey(Long showingId, Long seatId) {
        return SEAT_LOCK_PREFIX + showingId + ":" + seatId;
    }
}
