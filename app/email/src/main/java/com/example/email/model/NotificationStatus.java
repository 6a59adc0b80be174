/*
 * どこで: Email 配信ドメインモデル
 * 何を: 通知レコードの状態と許可される遷移を表す列挙
 * なぜ: DB と処理ロジックの状態遷移を一か所で固定するため
 */
package com.example.email.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum NotificationStatus {
  PENDING,
  PROCESSING,
  DELIVERED,
  FAILED,
  BOUNCED;

  // API では小文字で公開し、DB には name() を保存する
  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean isTerminal() {
    return this == DELIVERED || this == FAILED || this == BOUNCED;
  }

  public boolean canTransitionTo(NotificationStatus next) {
    return switch (this) {
      case PENDING -> next == PROCESSING;
      case PROCESSING -> next == DELIVERED || next == PENDING || next == FAILED;
      case DELIVERED, FAILED, BOUNCED -> false;
    };
  }

  public static NotificationStatus fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("status is required");
    }
    for (NotificationStatus status : values()) {
      if (status.value().equalsIgnoreCase(value.trim())) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown status: " + value);
  }
}
