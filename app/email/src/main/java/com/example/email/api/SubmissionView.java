/*
 * どこで: Email 配信 API
 * 何を: 受付応答の data 部
 * なぜ: 受付時点の request_id と状態をクライアントへ返すため
 */
package com.example.email.api;

import com.example.email.model.NotificationStatus;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SubmissionView(String requestId, NotificationStatus status) {}
