/*
 * どこで: Email 配信サービス層
 * 何を: 終端状態の request_id が再投入されたことを表す例外
 * なぜ: API 層で 409 へ変換するため
 */
package com.example.email.service;

import com.example.email.model.NotificationStatus;

public class NotificationConflictException extends RuntimeException {

  private final String requestId;
  private final NotificationStatus status;

  public NotificationConflictException(String requestId, NotificationStatus status) {
    super("notification already " + status.value() + " request_id=" + requestId);
    this.requestId = requestId;
    this.status = status;
  }

  public String getRequestId() {
    return requestId;
  }

  public NotificationStatus getStatus() {
    return status;
  }
}
