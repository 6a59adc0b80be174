/*
 * どこで: Email 配信ドメインモデル
 * 何を: 検証済みの配信リクエスト (キュー/DLQ のワイヤ形式を兼ねる)
 * なぜ: コアが型付きの入力だけを扱うようにするため
 */
package com.example.email.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationPayload(
    NotificationType notificationType,
    String userId,
    String templateCode,
    Map<String, Object> variables,
    String requestId,
    int priority,
    Map<String, Object> metadata) {

  public static final int DEFAULT_PRIORITY = 10;
  public static final String VARIABLE_EMAIL = "email";
  public static final String VARIABLE_SUBJECT = "subject";
  public static final String METADATA_CORRELATION_ID = "correlation_id";

  public NotificationPayload {
    // 変数値に null を含み得るため Map.copyOf ではなく LinkedHashMap でコピーする
    variables = copyOf(variables);
    metadata = copyOf(metadata);
  }

  @JsonIgnore
  public String emailAddress() {
    return stringValue(variables.get(VARIABLE_EMAIL));
  }

  @JsonIgnore
  public String subject() {
    final String subject = stringValue(variables.get(VARIABLE_SUBJECT));
    return subject != null ? subject : "Notification: " + templateCode;
  }

  @JsonIgnore
  public String correlationId() {
    final String correlationId = stringValue(metadata.get(METADATA_CORRELATION_ID));
    return correlationId != null ? correlationId : requestId;
  }

  private static Map<String, Object> copyOf(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptyMap();
    }
    return Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }

  private static String stringValue(Object value) {
    if (value == null) {
      return null;
    }
    final String text = value.toString();
    return text.isBlank() ? null : text;
  }
}
