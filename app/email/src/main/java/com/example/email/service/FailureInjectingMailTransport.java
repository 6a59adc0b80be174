/*
 * どこで: Email 配信サービス層
 * 何を: CI/Test 専用で宛先プレフィックスに応じて送信失敗を注入する
 * なぜ: 実コード経路を汚さずに E2E で retry -> dead-letter を再現するため
 */
package com.example.email.service;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "email.delivery.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingMailTransport implements MailTransport {

  private final LocalMailTransport delegate;

  @Value("${email.delivery.failure-injection.address-prefix:}")
  private String addressPrefix;

  @Override
  public void send(MailMessage message) {
    if (shouldInjectFailure(message.to())) {
      throw new MailTransportException(
          "mail delivery failure injection matched to=" + message.to());
    }
    delegate.send(message);
  }

  private boolean shouldInjectFailure(String to) {
    if (addressPrefix == null || addressPrefix.isBlank()) {
      return false;
    }
    // メールアドレスの大文字小文字は区別しない
    return to.regionMatches(true, 0, addressPrefix, 0, addressPrefix.length());
  }
}
