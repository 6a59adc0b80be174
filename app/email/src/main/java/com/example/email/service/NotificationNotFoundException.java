/*
 * どこで: Email 配信サービス層
 * 何を: 照会された request_id の記録が存在しないことを表す例外
 * なぜ: API 層で 404 へ変換するため
 */
package com.example.email.service;

public class NotificationNotFoundException extends RuntimeException {

  public NotificationNotFoundException(String requestId) {
    super("No notification with request_id=" + requestId);
  }
}
