/*
 * どこで: Email 配信ドメインモデル
 * 何を: notifications テーブルのスナップショット
 * なぜ: 配信処理と照会 API で共通化するため
 */
package com.example.email.model;

import java.time.Instant;

public record NotificationRecord(
    String requestId,
    String userId,
    String toAddress,
    String templateCode,
    String variablesJson,
    NotificationStatus status,
    int attempts,
    String error,
    String lockedBy,
    Instant leaseUntil,
    Instant createdAt,
    Instant updatedAt) {

  public NotificationRecord {
    if (requestId == null || requestId.isBlank()) {
      throw new IllegalArgumentException("requestId is required");
    }
    if (status == null) {
      throw new IllegalArgumentException("status is required");
    }
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must not be negative");
    }
  }

  /**
   * 1 回分の試行結果を反映した次の状態を返す。attempts は必ず 1 増える。
   *
   * @throws IllegalStateException 許可されていない状態遷移の場合
   */
  public NotificationRecord completeAttempt(NotificationStatus next, String nextError, Instant now) {
    if (!status.canTransitionTo(next)) {
      throw new IllegalStateException(
          "illegal status transition " + status + " -> " + next + " requestId=" + requestId);
    }
    return new NotificationRecord(
        requestId,
        userId,
        toAddress,
        templateCode,
        variablesJson,
        next,
        attempts + 1,
        nextError,
        null,
        null,
        createdAt,
        now);
  }
}
