/*
 * どこで: Email 配信 API
 * 何を: エラー応答の分類と HTTP ステータスの対応
 * なぜ: 同じ HTTP ステータスでも原因を区別できるようにするため
 */
package com.example.email.api;

import org.springframework.http.HttpStatus;

public enum ApiErrorCode {
  VALIDATION_ERROR(HttpStatus.BAD_REQUEST, "Validation failed"),
  UNSUPPORTED_CHANNEL(HttpStatus.BAD_REQUEST, "Notification type not supported"),
  ALREADY_DELIVERED(HttpStatus.CONFLICT, "Notification already delivered"),
  ALREADY_FAILED(HttpStatus.CONFLICT, "Notification permanently failed"),
  NOT_FOUND(HttpStatus.NOT_FOUND, "Notification not found"),
  QUEUE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Notification queue unavailable"),
  INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");

  private final HttpStatus status;
  private final String message;

  ApiErrorCode(HttpStatus status, String message) {
    this.status = status;
    this.message = message;
  }

  public HttpStatus status() {
    return status;
  }

  public String message() {
    return message;
  }
}
