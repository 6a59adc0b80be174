/*
 * どこで: Email 配信 API
 * 何を: 簡易ヘルスレスポンスを返す
 * なぜ: ロードバランサやオーケストレータから Actuator を介さずに生存確認するため
 */
package com.example.email.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Clock;
import java.time.Instant;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

  private final Clock clock;
  private final String serviceName;
  private final String version;

  public HealthController(
      Clock clock,
      @Value("${spring.application.name:email-service}") String serviceName,
      @Value("${email.version:0.1.0}") String version) {
    this.clock = clock;
    this.serviceName = serviceName;
    this.version = version;
  }

  @GetMapping("/health")
  public HealthResponse health() {
    return new HealthResponse("healthy", serviceName, version, clock.instant());
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record HealthResponse(String status, String service, String version, Instant timestamp) {}
}
