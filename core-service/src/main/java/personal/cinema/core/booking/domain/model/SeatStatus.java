package personal.cinema.core.booking.domain.model;

/**
 * Seat Status Enum
 * 좌석의 물리적 상태 (카탈로그 소유, 상영 중에는 관리자 조치로만 변경)
 */
public enum SeatStatus {
    /**
     * 판매 가능
     */
    AVAILABLE,

    /**
     * 상시 점유 (관계자석 등)
     */
    OCCUPIED,

    /**
     * 정비 중
     */
    MAINTENANCE,

    /**
     * 판매 차단
     */
    BLOCKED
}
