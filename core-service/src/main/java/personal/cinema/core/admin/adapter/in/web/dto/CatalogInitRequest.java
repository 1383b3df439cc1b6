package personal.cinema.core.admin.adapter.in.web.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import personal.cinema.core.admin.application.service.CatalogInitCommand;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 카탈로그 초기화 요청 DTO
 */
public record CatalogInitRequest(
        @NotNull Long screenId,
        @NotNull Long movieId,
        @Min(1) @Max(26) int rowCount,
        @Min(1) @Max(50) int seatsPerRow,
        @Min(0) int premiumRowCount,
        @Min(0) int vipRowCount,
        @NotNull @DecimalMin("0.00") BigDecimal basePrice,
        @NotEmpty List<@Valid ShowingSlot> showings
) {
    public CatalogInitCommand toCommand() {
        return new CatalogInitCommand(screenId, movieId, rowCount, seatsPerRow, premiumRowCount, vipRowCount,
                basePrice, showings.stream()
                .map(slot -> new CatalogInitCommand.Slot(slot.startTime(), slot.endTime()))
                .toList());
    }

    public record ShowingSlot(
            @NotNull LocalDateTime startTime,
            @NotNull LocalDateTime endTime
    ) {
    }
}
