package personal.cinema.core.booking.domain.exception;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;
import personal.cinema.core.booking.domain.model.Showing;

/**
 * Showing Overlap Exception
 * 같은 상영관에 시간이 겹치는 상영 일정을 등록하려는 경우 발생
 */
public class ShowingOverlapException extends BusinessException {
    public ShowingOverlapException(Showing candidate, Showing existing) {
        super(ErrorCode.SHOWING_OVERLAP,
                String.format("Showing overlaps existing showing: screenId=%d, existingShowingId=%d, start=%s, end=%s",
                        candidate.screenId(), existing.id(), candidate.startTime(), candidate.endTime()));
    }
}
