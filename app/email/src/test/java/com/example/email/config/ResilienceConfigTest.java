/*
 * どこで: Email 配信レジリエンス設定のユニットテスト
 * 何を: 設定から組み立てたブレーカーの closed/open/half-open 遷移と除外例外の扱いを検証する
 * なぜ: 障害中の依存先を呼ばないことと、復帰確認が 1 件だけ行われることを保証するため
 */
package com.example.email.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.email.MutableClock;
import com.example.email.TestFixtures;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreaker.State;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResilienceConfigTest {

  private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");
  private static final Duration RESET_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration PAST_RESET_TIMEOUT = RESET_TIMEOUT.plusSeconds(1);

  private MutableClock clock;
  private CircuitBreaker breaker;
  private AtomicInteger invocations;
  private ExecutorService executor;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(START);
    breaker = TestFixtures.circuitBreaker("template", 3, RESET_TIMEOUT, clock);
    invocations = new AtomicInteger();
    executor = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void opensAfterConsecutiveFailuresReachThreshold() {
    fail(2);
    assertThat(breaker.getState()).isEqualTo(State.CLOSED);

    fail(1);

    assertThat(breaker.getState()).isEqualTo(State.OPEN);
    assertThat(breaker.getMetrics().getNumberOfFailedCalls()).isEqualTo(3);
  }

  @Test
  void successBetweenFailuresKeepsBreakerClosed() {
    fail(2);
    assertThat(breaker.executeSupplier(this::succeed)).isEqualTo("ok");
    fail(2);

    assertThat(breaker.getState()).isEqualTo(State.CLOSED);
  }

  @Test
  void openBreakerRejectsWithoutInvokingDependency() {
    fail(3);
    invocations.set(0);

    assertThatThrownBy(() -> breaker.executeSupplier(this::succeed))
        .isInstanceOf(CallNotPermittedException.class)
        .hasMessageContaining("'template' is OPEN");
    assertThat(invocations).hasValue(0);
  }

  @Test
  void openBreakerStillRejectsJustBeforeResetTimeout() {
    fail(3);
    clock.advance(RESET_TIMEOUT.minusSeconds(1));

    assertThatThrownBy(() -> breaker.executeSupplier(this::succeed))
        .isInstanceOf(CallNotPermittedException.class);
  }

  @Test
  void trialAfterResetTimeoutClosesOnSuccess() {
    fail(3);
    clock.advance(PAST_RESET_TIMEOUT);

    assertThat(breaker.executeSupplier(this::succeed)).isEqualTo("ok");

    assertThat(breaker.getState()).isEqualTo(State.CLOSED);
    assertThat(breaker.getMetrics().getNumberOfFailedCalls()).isZero();
  }

  @Test
  void trialFailureReopensAndRestartsTimer() {
    fail(3);
    clock.advance(PAST_RESET_TIMEOUT);

    fail(1);

    assertThat(breaker.getState()).isEqualTo(State.OPEN);
    clock.advance(RESET_TIMEOUT.minusSeconds(1));
    assertThatThrownBy(() -> breaker.executeSupplier(this::succeed))
        .isInstanceOf(CallNotPermittedException.class);
  }

  @Test
  void excludedExceptionIsRethrownWithoutCountingAsFailure() {
    for (int i = 0; i < 5; i++) {
      assertThatThrownBy(() -> breaker.executeSupplier(this::rejectInput))
          .isInstanceOf(IllegalArgumentException.class);
    }

    assertThat(breaker.getState()).isEqualTo(State.CLOSED);
    assertThat(breaker.getMetrics().getNumberOfFailedCalls()).isZero();
  }

  @Test
  void excludedExceptionDuringTrialClosesBreaker() {
    fail(3);
    clock.advance(PAST_RESET_TIMEOUT);

    assertThatThrownBy(() -> breaker.executeSupplier(this::rejectInput))
        .isInstanceOf(IllegalArgumentException.class);

    assertThat(breaker.getState()).isEqualTo(State.CLOSED);
  }

  @Test
  void onlyOneTrialIsAllowedWhileHalfOpen() throws Exception {
    fail(3);
    clock.advance(PAST_RESET_TIMEOUT);
    final CountDownLatch trialStarted = new CountDownLatch(1);
    final CountDownLatch releaseTrial = new CountDownLatch(1);

    final Future<String> trial =
        executor.submit(() -> breaker.executeSupplier(() -> block(trialStarted, releaseTrial)));
    assertThat(trialStarted.await(5, TimeUnit.SECONDS)).isTrue();

    // 試行中の他の呼び出しは依存先へ到達せずに拒否される
    assertThat(breaker.getState()).isEqualTo(State.HALF_OPEN);
    assertThatThrownBy(() -> breaker.executeSupplier(this::succeed))
        .isInstanceOf(CallNotPermittedException.class);

    releaseTrial.countDown();
    assertThat(trial.get(5, TimeUnit.SECONDS)).isEqualTo("slow");
    assertThat(breaker.getState()).isEqualTo(State.CLOSED);
  }

  @Test
  void slowSuccessAdmittedBeforeTripDoesNotCloseOpenBreaker() throws Exception {
    final CountDownLatch slowStarted = new CountDownLatch(1);
    final CountDownLatch releaseSlow = new CountDownLatch(1);
    final Future<String> slowCall =
        executor.submit(() -> breaker.executeSupplier(() -> block(slowStarted, releaseSlow)));
    assertThat(slowStarted.await(5, TimeUnit.SECONDS)).isTrue();

    fail(3);
    assertThat(breaker.getState()).isEqualTo(State.OPEN);

    // closed 中に受け付けた呼び出しが open 後に成功しても、待ち時間を経ずに closed へは戻らない
    releaseSlow.countDown();
    assertThat(slowCall.get(5, TimeUnit.SECONDS)).isEqualTo("slow");

    assertThat(breaker.getState()).isEqualTo(State.OPEN);
    assertThatThrownBy(() -> breaker.executeSupplier(this::succeed))
        .isInstanceOf(CallNotPermittedException.class);
  }

  @Test
  void configuredExclusionsReplaceDefault() {
    final CircuitBreakerProperties.Breaker settings =
        new CircuitBreakerProperties.Breaker(
            1, RESET_TIMEOUT, List.of(IllegalStateException.class));
    final CircuitBreaker transport =
        CircuitBreaker.of("transport", ResilienceConfig.breakerConfig(settings));

    assertThatThrownBy(
            () ->
                transport.executeRunnable(
                    () -> {
                      throw new IllegalStateException("bounced");
                    }))
        .isInstanceOf(IllegalStateException.class);
    assertThat(transport.getState()).isEqualTo(State.CLOSED);

    assertThatThrownBy(() -> transport.executeSupplier(this::rejectInput))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(transport.getState()).isEqualTo(State.OPEN);
  }

  private String succeed() {
    invocations.incrementAndGet();
    return "ok";
  }

  private String rejectInput() {
    throw new IllegalArgumentException("bad input");
  }

  private void fail(int times) {
    for (int i = 0; i < times; i++) {
      assertThatThrownBy(
              () ->
                  breaker.executeSupplier(
                      () -> {
                        invocations.incrementAndGet();
                        throw new IllegalStateException("dependency down");
                      }))
          .isInstanceOf(IllegalStateException.class);
    }
  }

  private static String block(CountDownLatch started, CountDownLatch release) {
    started.countDown();
    try {
      release.await(5, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(ex);
    }
    return "slow";
  }
}
