package personal.cinema.core.booking.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * 홀드 연장 요청 DTO (minutes 생략 시 기본값)
 */
public record ExtendHoldRequest(
        @Min(value = 1, message = "연장 시간은 1분 이상이어야 합니다.")
        @Max(value = 60, message = "연장 시간은 60분을 넘을 수 없습니다.")
        Integer minutes
) {
}
