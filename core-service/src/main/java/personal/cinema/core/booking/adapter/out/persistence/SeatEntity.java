package personal.cinema.core.booking.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.cinema.core.booking.domain.model.Seat;
import personal.cinema.core.booking.domain.model.SeatStatus;
import personal.cinema.core.booking.domain.model.SeatType;

/**
 * Seat JPA Entity
 * 좌석 카탈로그 테이블 매핑
 */
@Entity
@Table(name = "seats",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_seat_screen_row_number",
                        columnNames = {"screen_id", "row_label", "seat_number"}),
                @UniqueConstraint(name = "uk_seat_screen_position",
                        columnNames = {"screen_id", "position_x", "position_y"})
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class SeatEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "screen_id", nullable = false)
    private Long screenId;

    @Column(name = "row_label", nullable = false, length = 5)
    private String rowLabel;

    @Column(name = "seat_number", nullable = false)
    private int seatNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "seat_type", nullable = false, length = 20)
    private SeatType seatType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SeatStatus status;

    @Column(name = "is_accessible", nullable = false)
    private boolean accessible;

    @Column(name = "is_couple", nullable = false)
    private boolean couple;

    @Column(name = "position_x", nullable = false)
    private int positionX;

    @Column(name = "position_y", nullable = false)
    private int positionY;

    public static SeatEntity fromDomain(Seat seat) {
        SeatEntity entity = new SeatEntity();
        entity.id = seat.id();
        entity.screenId = seat.screenId();
        entity.rowLabel = seat.rowLabel();
        entity.seatNumber = seat.seatNumber();
        entity.seatType = seat.type();
        entity.status = seat.status();
        entity.accessible = seat.accessible();
        entity.couple = seat.couple();
        entity.positionX = seat.positionX();
        entity.positionY = seat.positionY();
        return entity;
    }

    public Seat toDomain() {
        return new Seat(id, screenId, rowLabel, seatNumber, seatType, status,
                accessible, couple, positionX, positionY);
    }
}
