package personal.cinema.core.admin.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.core.booking.application.port.out.SeatRepository;
import personal.cinema.core.booking.application.port.out.ShowingRepository;
import personal.cinema.core.booking.domain.exception.ShowingOverlapException;
import personal.cinema.core.booking.domain.model.Seat;
import personal.cinema.core.booking.domain.model.SeatType;
import personal.cinema.core.booking.domain.model.Showing;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Catalog Initialization Service
 *
 * 개발/테스트용 카탈로그 데이터 생성 서비스
 * 상영관 좌석을 만들고(이미 있으면 재사용), 겹치지 않는 상영 일정을 등록한다.
 *
 * WARNING: 테스트 전용 - 프로덕션에서 비활성화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogInitService {

    private final SeatRepository seatRepository;
    private final ShowingRepository showingRepository;

    /**
     * @return 생성 결과 (screenId, seats, showingIds)
     * @throws ShowingOverlapException 같은 상영관의 상영 구간이 겹칠 때 (전체 롤백)
     */
    @Transactional
    public Map<String, Object> initialize(CatalogInitCommand command) {
        if (command.premiumRowCount() + command.vipRowCount() > command.rowCount()) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Premium and VIP rows cannot exceed the total row count");
        }

        List<Seat> seats = seatRepository.findByScreenId(command.screenId());
        if (seats.isEmpty()) {
            seats = seatRepository.saveAll(layoutSeats(command));
            log.info("Seats created: screenId={}, count={}", command.screenId(), seats.size());
        } else {
            log.info("Reusing existing seats: screenId={}, count={}", command.screenId(), seats.size());
        }

        List<Showing> scheduled = new ArrayList<>(showingRepository.findByScreenId(command.screenId()));
        List<Long> showingIds = new ArrayList<>();
        for (CatalogInitCommand.Slot slot : command.showings()) {
            Showing candidate = Showing.create(command.movieId(), command.screenId(),
                    slot.startTime(), slot.endTime(), command.basePrice());

            for (Showing existing : scheduled) {
                if (candidate.overlaps(existing)) {
                    throw new ShowingOverlapException(candidate, existing);
                }
            }

            Showing saved = showingRepository.save(candidate);
            scheduled.add(saved);
            showingIds.add(saved.id());
        }

        log.info("Catalog initialized: screenId={}, seats={}, showings={}",
                command.screenId(), seats.size(), showingIds);

        return Map.of(
                "screenId", command.screenId(),
                "seats", seats.size(),
                "showingIds", showingIds
        );
    }

    private List<Seat> layoutSeats(CatalogInitCommand command) {
        int standardRows = command.rowCount() - command.premiumRowCount() - command.vipRowCount();
        List<Seat> seats = new ArrayList<>();
        for (int row = 0; row < command.rowCount(); row++) {
            String rowLabel = String.valueOf((char) ('A' + row));
            SeatType type = row < standardRows
                    ? SeatType.STANDARD
                    : row < standardRows + command.premiumRowCount() ? SeatType.PREMIUM : SeatType.VIP;

            for (int number = 1; number <= command.seatsPerRow(); number++) {
                seats.add(Seat.create(command.screenId(), rowLabel, number, type, number, row + 1));
            }
        }
        return seats;
    }
}
