package personal.cinema.core.booking.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Booking Status Enum
 * PENDING -> {CONFIRMED, CANCELLED, EXPIRED}, CONFIRMED -> CANCELLED
 */
public enum BookingStatus {
    /**
     * 결제 대기 (만료 시각까지 좌석 점유)
     */
    PENDING,

    /**
     * 결제 완료
     */
    CONFIRMED,

    /**
     * 취소
     */
    CANCELLED,

    /**
     * 결제 대기 시간 초과
     */
    EXPIRED;

    public boolean canTransitionTo(BookingStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isTerminal() {
        return allowedTargets().isEmpty();
    }

    private Set<BookingStatus> allowedTargets() {
        return switch (this) {
            case PENDING -> EnumSet.of(CONFIRMED, CANCELLED, EXPIRED);
            case CONFIRMED -> EnumSet.of(CANCELLED);
            case CANCELLED, EXPIRED -> EnumSet.noneOf(BookingStatus.class);
        };
    }
}
