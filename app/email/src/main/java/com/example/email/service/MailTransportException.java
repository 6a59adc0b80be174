/*
 * どこで: Email 配信サービス層
 * 何を: メール送信の失敗を表現する
 * なぜ: 送信手段ごとの例外を一時失敗として一律に扱うため
 */
package com.example.email.service;

public class MailTransportException extends RuntimeException {

  public MailTransportException(String message) {
    super(message);
  }

  public MailTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
