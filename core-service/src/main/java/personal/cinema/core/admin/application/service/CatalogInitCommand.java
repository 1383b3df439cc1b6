package personal.cinema.core.admin.application.service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Catalog Init Command
 * 앞쪽 행부터 STANDARD, 그 뒤 PREMIUM, 마지막 행들이 VIP로 배치된다.
 */
public record CatalogInitCommand(
        Long screenId,
        Long movieId,
        int rowCount,
        int seatsPerRow,
        int premiumRowCount,
        int vipRowCount,
        BigDecimal basePrice,
        List<Slot> showings
) {
    public record Slot(LocalDateTime startTime, LocalDateTime endTime) {
    }
}
