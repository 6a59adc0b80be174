/*
 * どこで: Email 配信サービス層
 * 何を: メール送信を模擬する実装
 * なぜ: SMTP サーバーなしでも状態遷移を確認するため
 */
package com.example.email.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(
    prefix = "email.smtp",
    name = "enabled",
    havingValue = "false",
    matchIfMissing = true)
public class LocalMailTransport implements MailTransport {

  private static final Logger logger = LoggerFactory.getLogger(LocalMailTransport.class);

  @Override
  public void send(MailMessage message) {
    // 実送信は行わず、ログに残すだけとする
    logger.info(
        "mail simulated send to={} subject={} html={} bodyLength={}",
        message.to(),
        message.subject(),
        message.html(),
        message.body().length());
  }
}
