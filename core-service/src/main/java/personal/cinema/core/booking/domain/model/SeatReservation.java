package personal.cinema.core.booking.domain.model;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.core.booking.domain.exception.ReservationNotFoundException;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Seat Reservation Domain Model
 * 한 사용자가 한 상영의 한 좌석에 대해 가지는 임시 홀드 (불변)
 * now > expiresAt 이면 논리적으로 소멸한 것으로 본다.
 */
public record SeatReservation(
        Long id,
        Long userId,
        Long showingId,
        Long seatId,
        String sessionId,
        LocalDateTime createdAt,
        LocalDateTime expiresAt
) {
    public SeatReservation {
        if (userId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "User ID cannot be null");
        }
        if (showingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Showing ID cannot be null");
        }
        if (seatId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat ID cannot be null");
        }
        if (createdAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Creation time cannot be null");
        }
        if (expiresAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Expiration time cannot be null");
        }
    }

    /**
     * 홀드 생성 (정적 팩토리 메서드)
     *
     * @param userId    사용자 ID
     * @param showingId 상영 ID
     * @param seatId    좌석 ID
     * @param sessionId 클라이언트 세션 ID (선택)
     * @param now       현재 시각
     * @param ttl       홀드 유지 시간
     * @return 새로운 홀드
     */
    public static SeatReservation create(Long userId, Long showingId, Long seatId, String sessionId,
                                         LocalDateTime now, Duration ttl) {
        return new SeatReservation(null, userId, showingId, seatId, sessionId, now, now.plus(ttl));
    }

    public boolean isExpired(LocalDateTime now) {
        return now.isAfter(expiresAt);
    }

    public boolean isLive(LocalDateTime now) {
        return !isExpired(now);
    }

    public boolean isOwnedBy(Long requestUserId) {
        return userId.equals(requestUserId);
    }

    /**
     * 소유권 검증
     * 타인의 홀드는 존재하지 않는 것으로 취급한다.
     *
     * @throws ReservationNotFoundException 소유자가 아닐 때
     */
    public void ensureOwnership(Long requestUserId) {
        if (!isOwnedBy(requestUserId)) {
            throw new ReservationNotFoundException(id);
        }
    }

    /**
     * 만료 시각 연장
     * 이미 만료된 홀드는 되살릴 수 없다.
     *
     * @throws ReservationNotFoundException 이미 만료된 경우
     */
    public SeatReservation extend(Duration extension, LocalDateTime now) {
        if (isExpired(now)) {
            throw new ReservationNotFoundException(id);
        }
        return new SeatReservation(id, userId, showingId, seatId, sessionId, createdAt, expiresAt.plus(extension));
    }
}
