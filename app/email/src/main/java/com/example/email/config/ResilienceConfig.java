/*
 * どこで: Email 配信のインフラ設定
 * 何を: テンプレート取得用とメール送信用の Resilience4j サーキットブレーカーを生成し、状態をメトリクスとログへ出す
 * なぜ: 依存先ごとに独立したブレーカーをプロセス内で 1 つずつ共有するため
 */
package com.example.email.config;

import com.example.email.service.DeliveryMetrics;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig.SlidingWindowType;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.micrometer.tagged.TaggedCircuitBreakerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ResilienceConfig {

  public static final String TEMPLATE_BREAKER = "templateCircuitBreaker";
  public static final String TRANSPORT_BREAKER = "transportCircuitBreaker";

  private static final Logger logger = LoggerFactory.getLogger(ResilienceConfig.class);

  // 直近 N 件がすべて失敗したときだけ open させ、連続失敗回数の閾値として扱う
  private static final float ALL_CALLS_FAILED = 100.0f;

  @Bean
  public CircuitBreakerRegistry circuitBreakerRegistry(MeterRegistry meterRegistry) {
    final CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
    TaggedCircuitBreakerMetrics.ofCircuitBreakerRegistry(registry).bindTo(meterRegistry);
    return registry;
  }

  @Bean(TEMPLATE_BREAKER)
  CircuitBreaker templateCircuitBreaker(
      CircuitBreakerRegistry registry,
      CircuitBreakerProperties properties,
      DeliveryMetrics metrics) {
    return register(
        registry.circuitBreaker("template", breakerConfig(properties.template())), metrics);
  }

  @Bean(TRANSPORT_BREAKER)
  CircuitBreaker transportCircuitBreaker(
      CircuitBreakerRegistry registry,
      CircuitBreakerProperties properties,
      DeliveryMetrics metrics) {
    return register(
        registry.circuitBreaker("transport", breakerConfig(properties.transport())), metrics);
  }

  /**
   * 連続失敗で open、待ち時間経過後に 1 件だけ half-open の試行を許す設定を組み立てる。
   *
   * <p>除外例外は失敗にも無視にもせず成功として記録するため、half-open の試行で発生すれば closed へ戻る。
   */
  public static CircuitBreakerConfig breakerConfig(CircuitBreakerProperties.Breaker settings) {
    return CircuitBreakerConfig.custom()
        .slidingWindowType(SlidingWindowType.COUNT_BASED)
        .slidingWindowSize(settings.failureThreshold())
        .minimumNumberOfCalls(settings.failureThreshold())
        .failureRateThreshold(ALL_CALLS_FAILED)
        .waitDurationInOpenState(settings.resetTimeout())
        .permittedNumberOfCallsInHalfOpenState(1)
        .recordException(error -> !settings.isExcluded(error))
        .build();
  }

  private CircuitBreaker register(CircuitBreaker breaker, DeliveryMetrics metrics) {
    breaker
        .getEventPublisher()
        .onStateTransition(
            event ->
                logger.info(
                    "circuit breaker state changed name={} transition={}",
                    event.getCircuitBreakerName(),
                    event.getStateTransition()))
        .onError(
            event ->
                logger.debug(
                    "circuit breaker recorded failure name={} error={}",
                    event.getCircuitBreakerName(),
                    event.getThrowable().toString()));
    metrics.registerCircuitBreaker(breaker);
    return breaker;
  }
}
