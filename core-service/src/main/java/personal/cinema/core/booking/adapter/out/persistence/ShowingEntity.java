package personal.cinema.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cinema.core.booking.domain.model.Showing;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Showing JPA Entity
 * 상영 일정 테이블 매핑 (읽기 모델)
 */
@Entity
@Table(name = "showings",
        indexes = {
                @Index(name = "idx_showing_screen_start", columnList = "screen_id, start_time")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ShowingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "movie_id", nullable = false)
    private Long movieId;

    @Column(name = "screen_id", nullable = false)
    private Long screenId;

    @Column(name = "start_time", nullable = false)
    private LocalDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalDateTime endTime;

    @Column(name = "base_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal basePrice;

    public static ShowingEntity fromDomain(Showing showing) {
        ShowingEntity entity = new ShowingEntity();
        entity.id = showing.id();
        entity.movieId = showing.movieId();
        entity.screenId = showing.screenId();
        entity.startTime = showing.startTime();
        entity.endTime = showing.endTime();
        entity.basePrice = showing.basePrice();
        return entity;
    }

    public Showing toDomain() {
        return new Showing(id, movieId, screenId, startTime, endTime, basePrice);
    }
}
