package personal.cinema.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * HTTP Status Code와 메시지를 함께 관리
 */
public enum ErrorCode {
    // Common (Cxxx)
    INVALID_INPUT(HttpStatus.BAD_REQUEST, "C001", "잘못된 입력값입니다."),
    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "C002", "인증이 필요합니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "C004", "요청한 리소스를 찾을 수 없습니다."),
    CONFLICT(HttpStatus.CONFLICT, "C005", "리소스 충돌이 발생했습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "C006", "서버 내부 오류가 발생했습니다."),

    // Booking Domain (Bxxx)
    SEAT_NOT_FOUND(HttpStatus.NOT_FOUND, "B001", "좌석을 찾을 수 없습니다."),
    SHOWING_NOT_FOUND(HttpStatus.NOT_FOUND, "B002", "상영 일정을 찾을 수 없습니다."),
    SEAT_UNAVAILABLE(HttpStatus.CONFLICT, "B003", "이미 선택되었거나 판매된 좌석입니다."),
    RESERVATION_NOT_FOUND(HttpStatus.NOT_FOUND, "B004", "좌석 홀드를 찾을 수 없습니다."),
    BOOKING_EXPIRED(HttpStatus.CONFLICT, "B005", "예매가 만료되었습니다."),
    BOOKING_NOT_FOUND(HttpStatus.NOT_FOUND, "B006", "예매를 찾을 수 없습니다."),
    INVALID_BOOKING_TRANSITION(HttpStatus.CONFLICT, "B007", "허용되지 않는 예매 상태 전이입니다."),
    SHOWING_OVERLAP(HttpStatus.CONFLICT, "B008", "같은 상영관의 다른 상영 일정과 시간이 겹칩니다.");

    private final HttpStatus httpStatus;
    private final String code;
    private final String message;

    ErrorCode(HttpStatus httpStatus, String code, String message) {
        this.httpStatus = httpStatus;
        this.code = code;
        this.message = message;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
