package personal.cinema.core.booking.domain.model;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Booking History Domain Model
 * 예매 감사 로그 한 건 (추가만 가능, 저장 후 변경 없음)
 *
 * @param actor    행위자 (예: "user:42", "system:expiry-sweep")
 * @param metadata 부가 정보 (취소 사유, 결제 수단 등)
 */
public record BookingHistory(
        Long id,
        Long bookingId,
        BookingAction action,
        String actor,
        LocalDateTime occurredAt,
        Map<String, String> metadata
) {
    public static final String SYSTEM_SWEEPER = "system:expiry-sweep";

    public BookingHistory {
        if (bookingId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Booking ID cannot be null");
        }
        if (action == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "History action cannot be null");
        }
        if (actor == null || actor.isBlank()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Actor cannot be null or blank");
        }
        if (occurredAt == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Occurrence time cannot be null");
        }
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static BookingHistory of(Long bookingId, BookingAction action, String actor,
                                    LocalDateTime occurredAt, Map<String, String> metadata) {
        return new BookingHistory(null, bookingId, action, actor, occurredAt, metadata);
    }

    public static String userActor(Long userId) {
        return "user:" + userId;
    }
}
