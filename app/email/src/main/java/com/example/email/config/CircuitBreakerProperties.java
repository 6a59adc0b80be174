/*
 * どこで: Email 配信設定
 * 何を: テンプレート取得とメール送信の各サーキットブレーカー設定を保持する
 * なぜ: 依存先ごとに閾値と復帰待ち時間を独立して調整するため
 */
package com.example.email.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "email.circuit-breaker")
@Validated
public record CircuitBreakerProperties(@Valid @NotNull Breaker template, @Valid @NotNull Breaker transport) {

  /**
   * @param failureThreshold open へ遷移する連続失敗回数
   * @param resetTimeout open から half-open の試行を許可するまでの待ち時間
   * @param excludedExceptions 失敗に数えず依存先からの応答として扱う例外型
   */
  public record Breaker(
      @Positive int failureThreshold,
      @NotNull Duration resetTimeout,
      List<Class<? extends Throwable>> excludedExceptions) {

    public Breaker {
      // 未指定時は入力不備 (IllegalArgumentException) を失敗に数えない
      excludedExceptions =
          excludedExceptions == null
              ? List.<Class<? extends Throwable>>of(IllegalArgumentException.class)
              : List.copyOf(excludedExceptions);
    }

    @AssertTrue(message = "reset-timeout must be positive")
    public boolean isResetTimeoutPositive() {
      return resetTimeout != null && !resetTimeout.isZero() && !resetTimeout.isNegative();
    }

    @AssertTrue(message = "excluded-exceptions must be Throwable types")
    public boolean isExcludedExceptionsThrowable() {
      // 型引数は実行時に消えるため、バインドされたクラスをここで確かめる
      return excludedExceptions.stream().allMatch(Throwable.class::isAssignableFrom);
    }

    public boolean isExcluded(Throwable error) {
      return excludedExceptions.stream().anyMatch(type -> type.isInstance(error));
    }
  }
}
