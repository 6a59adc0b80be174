/*
 * どこで: Email 配信 API
 * 何を: 配信記録の公開用表現
 * なぜ: lease などの内部項目を API に出さないため
 */
package com.example.email.api;

import com.example.email.model.NotificationRecord;
import com.example.email.model.NotificationStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationView(
    String requestId,
    String userId,
    String toEmail,
    String templateCode,
    NotificationStatus status,
    int attempts,
    String error,
    Instant createdAt,
    Instant updatedAt) {

  public static NotificationView from(NotificationRecord record) {
    return new NotificationView(
        record.requestId(),
        record.userId(),
        record.toAddress(),
        record.templateCode(),
        record.status(),
        record.attempts(),
        record.error(),
        record.createdAt(),
        record.updatedAt());
  }
}
