/*
 * どこで: Email 配信設定
 * 何を: SMTP 送信の有効/無効と送信元アドレスを保持する
 * なぜ: ローカル/テストでは実送信せず、本番のみ JavaMailSender を使うため
 */
package com.example.email.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "email.smtp")
public record SmtpProperties(boolean enabled, String from) {

  public SmtpProperties {
    from = from == null || from.isBlank() ? "noreply@example.com" : from;
  }
}
