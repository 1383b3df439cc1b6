package personal.cinema.core.booking.domain.exception;

import personal.cinema.common.exception.BusinessException;
import personal.cinema.common.exception.ErrorCode;

/**
 * Showing Not Found Exception
 */
public class ShowingNotFoundException extends BusinessException {
    public ShowingNotFoundException(Long showingId) {
        super(ErrorCode.SHOWING_NOT_FOUND,
                String.format("Showing not found: showingId=%d", showingId));
    }
}
