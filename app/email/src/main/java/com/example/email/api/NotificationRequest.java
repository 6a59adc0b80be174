/*
 * どこで: Email 配信 API
 * 何を: 配信要求の受付 DTO と入力検証
 * なぜ: 不正な入力を受付時点で 400 にし、コアへは型付きの要求だけを渡すため
 */
package com.example.email.api;

import com.example.email.model.NotificationPayload;
import com.example.email.model.NotificationType;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationRequest(
    @NotNull(message = "notification_type is required") NotificationType notificationType,
    @NotBlank(message = "user_id is required") String userId,
    @NotBlank(message = "template_code is required") String templateCode,
    Map<String, Object> variables,
    @NotBlank(message = "request_id is required")
        @Size(max = 255, message = "request_id must be at most 255 characters")
        String requestId,
    @Min(value = 1, message = "priority must be between 1 and 100")
        @Max(value = 100, message = "priority must be between 1 and 100")
        Integer priority,
    Map<String, Object> metadata) {

  public NotificationPayload toPayload() {
    return new NotificationPayload(
        notificationType,
        userId.trim(),
        templateCode.trim(),
        variables,
        requestId.trim(),
        priority == null ? NotificationPayload.DEFAULT_PRIORITY : priority,
        metadata);
  }
}
