package personal.cinema.core.booking.domain.model;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * Showing Domain Model
 * 상영 일정 도메인 모델 (불변)
 * 같은 상영관의 상영 구간 [startTime, endTime)은 서로 겹치지 않는다.
 */
public record Showing(
        Long id,
        Long movieId,
        Long screenId,
        LocalDateTime startTime,
        LocalDateTime endTime,
        BigDecimal basePrice
) {
    public Showing {
        if (movieId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Movie ID cannot be null");
        }
        if (screenId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Screen ID cannot be null");
        }
        if (startTime == null || endTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Showing time window cannot be null");
        }
        if (!startTime.isBefore(endTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("Showing must start before it ends: start=%s, end=%s", startTime, endTime));
        }
        if (basePrice == null || basePrice.compareTo(BigDecimal.ZERO) < 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Base price must not be negative");
        }
    }

    public static Showing create(Long movieId, Long screenId, LocalDateTime startTime,
                                 LocalDateTime endTime, BigDecimal basePrice) {
        return new Showing(null, movieId, screenId, startTime, endTime, basePrice);
    }

    /**
     * 상영 시작 여부 확인 (시작 시각 포함)
     */
    public boolean hasStarted(LocalDateTime now) {
        return !now.isBefore(startTime);
    }

    /**
     * 같은 상영관에서 상영 구간이 겹치는지 확인
     */
    public boolean overlaps(Showing other) {
        if (!screenId.equals(other.screenId())) {
            return false;
        }
        return startTime.isBefore(other.endTime()) && other.startTime().isBefore(endTime);
    }

    /**
     * 이 상영에서의 좌석 가격 (기본가 x 좌석 등급 배수)
     */
    public BigDecimal priceFor(Seat seat) {
        return basePrice.multiply(seat.type().getPriceMultiplier())
                .setScale(2, RoundingMode.HALF_UP);
    }
}
