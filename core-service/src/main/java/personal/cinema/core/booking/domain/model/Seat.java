package personal.cinema.core.booking.domain.model;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Seat Domain Model
 * 상영관 좌석 도메인 모델 (불변)
 * (screenId, rowLabel, seatNumber) 및 (screenId, positionX, positionY)는 카탈로그에서 유일하다.
 */
public record Seat(
        Long id,
        Long screenId,
        String rowLabel,
        int seatNumber,
        SeatType type,
        SeatStatus status,
        boolean accessible,
        boolean couple,
        int positionX,
        int positionY
) {
    public Seat {
        if (screenId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Screen ID cannot be null");
        }
        if (rowLabel == null || rowLabel.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Row label cannot be null or blank");
        }
        if (seatNumber <= 0) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat number must be positive");
        }
        if (type == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat type cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Seat status cannot be null");
        }
    }

    /**
     * 신규 좌석 생성 (ID 미할당)
     */
    public static Seat create(Long screenId, String rowLabel, int seatNumber, SeatType type,
                              int positionX, int positionY) {
        return new Seat(null, screenId, rowLabel, seatNumber, type, SeatStatus.AVAILABLE,
                false, false, positionX, positionY);
    }

    /**
     * 물리적으로 판매 가능한 좌석인지 확인
     * OCCUPIED, MAINTENANCE, BLOCKED 좌석은 예매 상태와 무관하게 항상 제외
     */
    public boolean isPhysicallyAvailable() {
        return status == SeatStatus.AVAILABLE;
    }

    public boolean isOnScreen(Long otherScreenId) {
        return screenId.equals(otherScreenId);
    }

    /**
     * 표시용 좌석명 (예: "C7")
     */
    public String label() {
        return rowLabel + seatNumber;
    }
}
