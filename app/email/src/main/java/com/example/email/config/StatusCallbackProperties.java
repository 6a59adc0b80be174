/*
 * どこで: Email 配信設定
 * 何を: 状態通知コールバックの送信先とタイムアウトを保持する
 * なぜ: コールバック未設定の環境では送信自体を行わないようにするため
 */
package com.example.email.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "email.status-callback")
public record StatusCallbackProperties(
    boolean enabled, String url, Duration connectTimeout, Duration readTimeout) {

  public StatusCallbackProperties {
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }

  public boolean isActive() {
    return enabled && url != null && !url.isBlank();
  }
}
