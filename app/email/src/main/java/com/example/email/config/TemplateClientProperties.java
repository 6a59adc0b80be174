/*
 * どこで: Email 配信設定
 * 何を: テンプレートサービスの接続先とタイムアウトを保持する
 * なぜ: 下流 URL を外部化し、呼び出しを時間で打ち切るため
 */
package com.example.email.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "email.template-client")
public record TemplateClientProperties(
    String baseUrl, String templatePath, Duration connectTimeout, Duration readTimeout) {

  public TemplateClientProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://template-service:8000" : baseUrl;
    templatePath =
        templatePath == null || templatePath.isBlank() ? "/templates/{templateCode}" : templatePath;
    connectTimeout = connectTimeout == null ? Duration.ofSeconds(2) : connectTimeout;
    readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
  }
}
