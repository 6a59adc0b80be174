/*
 * どこで: Email 配信サービス層
 * 何を: 配信要求の受付結果
 * なぜ: 新規投入と処理中の重複受付を API 層で区別するため
 */
package com.example.email.service;

import com.example.email.model.NotificationStatus;

public record SubmissionResult(String requestId, NotificationStatus status, boolean queued) {

  public static SubmissionResult queued(String requestId) {
    return new SubmissionResult(requestId, NotificationStatus.PENDING, true);
  }

  public static SubmissionResult inFlight(String requestId, NotificationStatus status) {
    return new SubmissionResult(requestId, status, false);
  }
}
