package personal.cinema.core.booking.application.port.in;

/**
 * Release Hold UseCase (Input Port)
 */
public interface ReleaseHoldUseCase {

    /**
     * 홀드 해제 (멱등)
     * 이미 해제되었거나 존재하지 않는 홀드는 오류 없이 무시한다.
     *
     * @param reservationId 홀드 ID
     * @param userId        사용자 ID
     * @throws personal.cinema.core.booking.domain.exception.ReservationNotFoundException 타인 소유의 홀드일 때
     */
    void releaseHold(Long reservationId, Long userId);
}
