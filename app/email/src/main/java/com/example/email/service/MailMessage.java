/*
 * どこで: Email 配信サービス層
 * 何を: 送信 1 通分の宛先/件名/本文
 * なぜ: 送信手段の実装から配信ロジックを切り離すため
 */
package com.example.email.service;

public record MailMessage(String to, String subject, String body, boolean html) {

  public MailMessage {
    if (to == null || to.isBlank()) {
      throw new IllegalArgumentException("to is required");
    }
    subject = subject == null ? "" : subject;
    body = body == null ? "" : body;
  }
}
