package personal.cinema.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import personal.cinema.core.booking.domain.model.BookingAction;

import java.time.LocalDateTime;

/**
 * Booking History JPA Entity
 * 추가 전용 감사 로그 (변경 메서드 없음)
 */
@Entity
@Table(name = "booking_history",
        indexes = {
                @Index(name = "idx_history_booking", columnList = "booking_id, occurred_at")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class BookingHistoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @OnDelete(action = OnDeleteAction.CASCADE)
    @JoinColumn(name = "booking_id", nullable = false, updatable = false)
    private BookingEntity booking;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private BookingAction action;

    @Column(nullable = false, length = 50, updatable = false)
    private String actor;

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private LocalDateTime occurredAt;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String metadata; // JSON

    public static BookingHistoryEntity create(BookingEntity booking, BookingAction action, String actor,
                                              LocalDateTime occurredAt, String metadata) {
        BookingHistoryEntity entity = new BookingHistoryEntity();
        entity.booking = booking;
        entity.action = action;
        entity.actor = actor;
        entity.occurredAt = occurredAt;
        entity.metadata = metadata;
        return entity;
    }
}
