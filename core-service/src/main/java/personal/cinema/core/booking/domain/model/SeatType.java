package personal.cinema.core.booking.domain.model;

import java.math.BigDecimal;

/**
 * Seat Type Enum
 * 좌석 등급과 상영 기본가 대비 가격 배수
 */
public enum SeatType {
    STANDARD(new BigDecimal("1.00")),
    PREMIUM(new BigDecimal("1.25")),
    VIP(new BigDecimal("1.50"));

    private final BigDecimal priceMultiplier;

    SeatType(BigDecimal priceMultiplier) {
        this.priceMultiplier = priceMultiplier;
    }

    public BigDecimal getPriceMultiplier() {
        return priceMultiplier;
    }
}
