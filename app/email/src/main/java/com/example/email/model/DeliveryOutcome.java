/*
 * どこで: Email 配信ドメインモデル
 * 何を: 1 回の配信処理の結果をスケジューラへ返す値
 * なぜ: 再試行の指示を例外ではなく戻り値で伝えるため
 */
package com.example.email.model;

import java.time.Duration;

public record DeliveryOutcome(Kind kind, Duration retryDelay, String reason) {

  public enum Kind {
    ALREADY_DELIVERED,
    DELIVERED,
    RETRY_SCHEDULED,
    PERMANENTLY_FAILED
  }

  public DeliveryOutcome {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
    if (kind == Kind.RETRY_SCHEDULED && (retryDelay == null || retryDelay.isNegative())) {
      throw new IllegalArgumentException("retryDelay must be zero or positive");
    }
  }

  public static DeliveryOutcome alreadyDelivered() {
    return new DeliveryOutcome(Kind.ALREADY_DELIVERED, null, null);
  }

  public static DeliveryOutcome delivered() {
    return new DeliveryOutcome(Kind.DELIVERED, null, null);
  }

  public static DeliveryOutcome retryScheduled(Duration delay) {
    return new DeliveryOutcome(Kind.RETRY_SCHEDULED, delay, null);
  }

  public static DeliveryOutcome permanentlyFailed(String reason) {
    return new DeliveryOutcome(Kind.PERMANENTLY_FAILED, null, reason);
  }

  // スケジューラが再投入すべきかどうか
  public boolean requiresRetry() {
    return kind == Kind.RETRY_SCHEDULED;
  }
}
