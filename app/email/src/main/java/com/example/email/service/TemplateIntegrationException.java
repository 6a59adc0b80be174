/*
 * どこで: Email 配信サービス層
 * 何を: テンプレートサービス呼び出しの失敗を表現する
 * なぜ: 失敗理由をログとブレーカー判定で区別するため
 */
package com.example.email.service;

public class TemplateIntegrationException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    TIMEOUT,
    INVALID_RESPONSE,
    BAD_GATEWAY
  }

  private final Reason reason;

  public TemplateIntegrationException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public TemplateIntegrationException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
