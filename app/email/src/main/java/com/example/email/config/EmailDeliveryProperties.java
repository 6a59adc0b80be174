/*
 * どこで: Email 配信設定
 * 何を: 再試行回数/バックオフ/リース/フォールバックテンプレートなど配信処理の運用パラメータを保持する
 * なぜ: リトライ方針を環境ごとに調整し、起動時に不正値を弾くため
 */
package com.example.email.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "email.delivery")
@Validated
public record EmailDeliveryProperties(
    @Positive int maxAttempts,
    @NotNull Duration backoffBase,
    @Positive double backoffExponentBase,
    @NotNull Duration backoffMax,
    @NotNull Duration lease,
    @NotNull Duration inFlightRetryDelay,
    @NotNull Duration persistenceRetryDelay,
    @Positive int errorMessageMaxLength,
    @NotNull MissingAddressPolicy missingAddressPolicy,
    @NotBlank String fallbackTemplate) {

  @AssertTrue(message = "email.delivery.backoff-max must not be shorter than backoff-base")
  public boolean isBackoffRangeValid() {
    if (backoffBase == null || backoffMax == null) {
      return true;
    }
    return isPositiveDuration(backoffBase) && backoffMax.compareTo(backoffBase) >= 0;
  }

  @AssertTrue(message = "email.delivery.lease must be positive")
  public boolean isLeasePositive() {
    return isPositiveDuration(lease);
  }

  @AssertTrue(message = "email.delivery retry delays must not be negative")
  public boolean isRetryDelaysValid() {
    // 0 は即時再投入として許容する
    return inFlightRetryDelay != null
        && !inFlightRetryDelay.isNegative()
        && persistenceRetryDelay != null
        && !persistenceRetryDelay.isNegative();
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
