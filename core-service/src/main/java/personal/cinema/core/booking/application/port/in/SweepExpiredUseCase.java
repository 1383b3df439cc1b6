package personal.cinema.core.booking.application.port.in;

/**
 * Sweep Expired UseCase (Input Port)
 * 논리적으로 만료된 홀드/예매를 물리적으로 정리한다.
 */
public interface SweepExpiredUseCase {

    /**
     * 만료된 홀드 삭제
     *
     * @return 삭제된 홀드 수
     */
    int sweepExpiredHolds();

    /**
     * 만료 시각이 지난 PENDING 예매를 EXPIRED로 전환
     *
     * @return 전환된 예매 수
     */
    int sweepExpiredBookings();
}
