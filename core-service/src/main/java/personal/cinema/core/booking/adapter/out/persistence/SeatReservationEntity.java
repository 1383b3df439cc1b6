package personal.cinema.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cinema.core.booking.domain.model.SeatReservation;

import java.time.LocalDateTime;

/**
 * Seat Reservation JPA Entity
 * 좌석 홀드 테이블 매핑
 * (showing_id, seat_id) 유니크 제약: 한 좌석에 행은 하나만 존재하며, 만료된 행은 새 홀드 전에 삭제된다.
 */
@Entity
@Table(name = "seat_reservations",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_reservation_showing_seat",
                columnNames = {"showing_id", "seat_id"}
        ),
        indexes = {
                @Index(name = "idx_reservation_expires_at", columnList = "expires_at"),
                @Index(name = "idx_reservation_user", columnList = "user_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SeatReservationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "showing_id", nullable = false)
    private Long showingId;

    @Column(name = "seat_id", nullable = false)
    private Long seatId;

    @Column(name = "session_id", length = 100)
    private String sessionId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    public static SeatReservationEntity fromDomain(SeatReservation reservation) {
        SeatReservationEntity entity = new SeatReservationEntity();
        entity.id = reservation.id();
        entity.userId = reservation.userId();
        entity.showingId = reservation.showingId();
        entity.seatId = reservation.seatId();
        entity.sessionId = reservation.sessionId();
        entity.createdAt = reservation.createdAt();
        entity.expiresAt = reservation.expiresAt();
        return entity;
    }

    public SeatReservation toDomain() {
        return new SeatReservation(id, userId, showingId, seatId, sessionId, createdAt, expiresAt);
    }

    /**
     * 만료 시각 변경 (영속성 컨텍스트 내에서 사용)
     */
    public void updateExpiresAt(LocalDateTime newExpiresAt) {
        this.expiresAt = newExpiresAt;
    }
}
