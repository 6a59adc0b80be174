/*
 * どこで: Email 配信サービス層
 * 何を: メール送信の抽象
 * なぜ: SMTP/ローカル/障害注入の実装を差し替えるため
 */
package com.example.email.service;

public interface MailTransport {

  /**
   * @throws MailTransportException 送信に失敗した場合
   */
  void send(MailMessage message);
}
