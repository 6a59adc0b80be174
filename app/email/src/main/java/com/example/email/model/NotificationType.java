/*
 * どこで: Email 配信ドメインモデル
 * 何を: 通知チャネルの種別
 * なぜ: push は拡張点として受け口だけを用意しておくため
 */
package com.example.email.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum NotificationType {
  EMAIL,
  PUSH;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static NotificationType fromValue(String value) {
    if (value == null) {
      return null;
    }
    for (NotificationType type : values()) {
      if (type.value().equalsIgnoreCase(value.trim())) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown notification_type: " + value);
  }
}
