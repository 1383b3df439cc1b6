package personal.cinema.core.acceptance.steps;

import io.cucumber.java.Before;
import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.ScenarioScope;
import io.restassured.response.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import personal.cinema.core.acceptance.support.BookingHttpAdapter;
import personal.cinema.core.acceptance.support.BookingTestContext;
import personal.cinema.core.support.BookingFixture;
import personal.cinema.core.support.MutableClock;
import personal.cinema.core.support.TestClockConfiguration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Booking Acceptance Test Step Definitions
 * 비즈니스 관점의 자연어로 작성된 시나리오에 매핑
 */
@Slf4j
@ScenarioScope
@RequiredArgsConstructor
public class BookingAcceptanceSteps {

    private final BookingHttpAdapter httpAdapter;
    private final BookingTestContext context;
    private final BookingFixture fixture;
    private final MutableClock clock;

    @Before
    public void resetClock() {
        clock.setTo(TestClockConfiguration.T0);
    }

    // ==========================================
    // 배경: 상영 준비
    // ==========================================

    @Given("{int}시간 뒤에 시작하는 상영이 등록되어 있다")
    public void 상영이_등록되어_있다(int hours) {
        log.info(">>> Given: {}시간 뒤 상영 등록", hours);
        fixture.clearAllData();
        context.setShowingId(fixture.createShowing(clock.now().plusHours(hours)));
        context.setSeatIds(fixture.seatIds());
    }

    // ==========================================
    // Given: 사전 상태
    // ==========================================

    @Given("{long}번 사용자가 {int}번 좌석을 홀드했다")
    public void 좌석을_홀드했다(Long userId, int seatNumber) {
        log.info(">>> Given: 사용자 {} 좌석 {} 홀드", userId, seatNumber);
        좌석을_홀드한다(userId, seatNumber);
        assertThat(context.getLastHttpResponse().statusCode()).isEqualTo(201);
    }

    @Given("{long}번 사용자가 {int}번 좌석을 예매했다")
    public void 좌석을_예매했다(Long userId, int seatNumber) {
        log.info(">>> Given: 사용자 {} 좌석 {} 예매", userId, seatNumber);
        좌석을_예매한다(userId, String.valueOf(seatNumber));
        assertThat(context.getLastHttpResponse().statusCode()).isEqualTo(201);
    }

    @Given("{long}번 사용자가 {int}번 좌석을 예매하고 결제를 완료했다")
    public void 좌석을_예매하고_결제를_완료했다(Long userId, int seatNumber) {
        좌석을_예매했다(userId, seatNumber);
        예매를_확정한다(userId, "CARD");
        assertThat(context.getLastHttpResponse().statusCode()).isEqualTo(200);
    }

    @Given("{int}번 좌석은 판매 중지 상태이다")
    public void 좌석은_판매_중지_상태이다(int seatNumber) {
        fixture.updateSeatStatus(context.seatId(seatNumber), "BLOCKED");
    }

    @And("{int}분이 지났다")
    public void 시간이_지났다(int minutes) {
        log.info(">>> Given: {}분 경과", minutes);
        clock.advance(Duration.ofMinutes(minutes));
    }

    // ==========================================
    // When: 사용자 행동
    // ==========================================

    @When("{long}번 사용자가 {int}번 좌석을 홀드한다")
    public void 좌석을_홀드한다(Long userId, int seatNumber) {
        log.info(">>> When: 사용자 {} 좌석 {} 홀드 요청", userId, seatNumber);
        Response response = httpAdapter.holdSeat(userId, context.getShowingId(), context.seatId(seatNumber));
        context.setLastHttpResponse(response);
        if (response.statusCode() == 201) {
            context.setLastReservationId(response.jsonPath().getLong("reservationId"));
        }
    }

    @When("{long}번 사용자가 홀드를 {int}분 연장한다")
    public void 홀드를_연장한다(Long userId, int minutes) {
        context.setLastHttpResponse(httpAdapter.extendHold(userId, context.getLastReservationId(), minutes));
    }

    @When("{long}번 사용자가 홀드를 해제한다")
    public void 홀드를_해제한다(Long userId) {
        context.setLastHttpResponse(httpAdapter.releaseHold(userId, context.getLastReservationId()));
    }

    @When("{long}번 사용자가 {string}번 좌석을 예매한다")
    public void 좌석을_예매한다(Long userId, String seatNumbers) {
        log.info(">>> When: 사용자 {} 좌석 [{}] 예매 요청", userId, seatNumbers);
        List<Long> seatIds = Arrays.stream(seatNumbers.split(","))
                .map(String::trim)
                .map(Integer::parseInt)
                .map(context::seatId)
                .toList();
        Response response = httpAdapter.createBooking(userId, context.getShowingId(), seatIds);
        context.setLastHttpResponse(response);
        if (response.statusCode() == 201) {
            context.setLastBookingId(response.jsonPath().getLong("bookingId"));
            context.setLastBookingUserId(userId);
        }
    }

    @When("{long}번 사용자가 {string} 결제로 예매를 확정한다")
    public void 예매를_확정한다(Long userId, String paymentMethod) {
        log.info(">>> When: 사용자 {} 예매 {} 확정 요청", userId, context.getLastBookingId());
        context.setLastHttpResponse(httpAdapter.confirmBooking(
                userId, context.getLastBookingId(), paymentMethod, "PAY-" + context.getLastBookingId()));
    }

    @When("{long}번 사용자가 예매를 취소한다")
    public void 예매를_취소한다(Long userId) {
        log.info(">>> When: 사용자 {} 예매 {} 취소 요청", userId, context.getLastBookingId());
        context.setLastHttpResponse(httpAdapter.cancelBooking(userId, context.getLastBookingId(), "일정 변경"));
    }

    @When("{int}명의 사용자가 동시에 {int}번 좌석을 홀드한다")
    public void 동시에_좌석을_홀드한다(int userCount, int seatNumber) {
        log.info(">>> When: {}명 동시 홀드 요청", userCount);
        Long showingId = context.getShowingId();
        Long seatId = context.seatId(seatNumber);
        AtomicInteger successCount = context.getSuccessCount();
        AtomicInteger conflictCount = context.getConflictCount();

        ExecutorService executor = Executors.newFixedThreadPool(userCount);
        try {
            List<CompletableFuture<Void>> futures = IntStream.rangeClosed(1, userCount)
                    .mapToObj(i -> CompletableFuture.runAsync(() -> {
                        int status = httpAdapter.holdSeat(100L + i, showingId, seatId).statusCode();
                        if (status == 201) {
                            successCount.incrementAndGet();
                        } else if (status == 409) {
                            conflictCount.incrementAndGet();
                        }
                    }, executor))
                    .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            executor.shutdown();
        }
        log.info(">>> 성공: {}, 충돌: {}", successCount.get(), conflictCount.get());
    }

    @When("예매 상세를 조회한다")
    public void 예매_상세를_조회한다() {
        context.setLastHttpResponse(
                httpAdapter.getBooking(context.getLastBookingUserId(), context.getLastBookingId()));
    }

    @When("예매 이력을 조회한다")
    public void 예매_이력을_조회한다() {
        context.setLastHttpResponse(
                httpAdapter.getHistory(context.getLastBookingUserId(), context.getLastBookingId()));
    }

    // ==========================================
    // Then: 결과 검증
    // ==========================================

    @Then("응답 상태 코드는 {int}이다")
    public void 응답_상태_코드는(int statusCode) {
        assertThat(context.getLastHttpResponse().statusCode()).isEqualTo(statusCode);
    }

    @And("에러 코드는 {string}이다")
    public void 에러_코드는(String code) {
        assertThat(context.getLastHttpResponse().jsonPath().getString("code")).isEqualTo(code);
    }

    @And("예매 상태는 {string}이다")
    public void 예매_상태는(String status) {
        assertThat(context.getLastHttpResponse().jsonPath().getString("status")).isEqualTo(status);
    }

    @And("결제 금액은 {string}이다")
    public void 결제_금액은(String amount) {
        BigDecimal totalAmount = new BigDecimal(context.getLastHttpResponse().jsonPath().getString("totalAmount"));
        assertThat(totalAmount).isEqualByComparingTo(amount);
    }

    @And("예매 이력은 {string} 순서이다")
    public void 예매_이력은_순서이다(String actions) {
        List<String> expected = Arrays.stream(actions.split(",")).map(String::trim).toList();
        assertThat(context.getLastHttpResponse().jsonPath().getList("action", String.class))
                .containsExactlyElementsOf(expected);
    }

    @Then("{int}번 좌석은 구매할 수 있다")
    public void 좌석은_구매할_수_있다(int seatNumber) {
        assertThat(availableSeatIds()).contains(context.seatId(seatNumber));
    }

    @Then("{int}번 좌석은 구매할 수 없다")
    public void 좌석은_구매할_수_없다(int seatNumber) {
        assertThat(availableSeatIds()).doesNotContain(context.seatId(seatNumber));
    }

    @Then("홀드에 성공한 사용자는 {int}명이다")
    public void 홀드에_성공한_사용자는(int count) {
        assertThat(context.getSuccessCount().get()).isEqualTo(count);
    }

    @And("나머지 {int}명은 좌석 충돌 응답을 받는다")
    public void 나머지는_좌석_충돌_응답을_받는다(int count) {
        assertThat(context.getConflictCount().get()).isEqualTo(count);
    }

    @And("좌석 홀드는 {int}건만 저장된다")
    public void 좌석_홀드는_저장된다(int count) {
        assertThat(fixture.count("seat_reservations")).isEqualTo(count);
    }

    private List<Long> availableSeatIds() {
        Response response = httpAdapter.getAvailability(context.getShowingId());
        assertThat(response.statusCode()).isEqualTo(200);
        return response.jsonPath().getList("availableSeatIds", Long.class);
    }
}
