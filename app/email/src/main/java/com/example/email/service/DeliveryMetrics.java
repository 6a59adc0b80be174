/*
 * どこで: Email 配信サービス層
 * 何を: 配信結果/E2E 遅延/dead-letter/状態通知失敗/ブレーカー状態のメトリクスを記録する
 * なぜ: 非同期配信の健全性を Prometheus から直接観測できるようにするため
 */
package com.example.email.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DeliveryMetrics {

  public static final String RESULT_DELIVERED = "delivered";
  public static final String RESULT_ALREADY_DELIVERED = "already_delivered";
  public static final String RESULT_RETRY = "retry";
  public static final String RESULT_FAILED = "failed";

  private static final String METRIC_DELIVERY_TOTAL = "email.delivery.total";
  private static final String METRIC_DELIVERY_E2E_DELAY = "email.delivery.e2e.delay";
  private static final String METRIC_DEAD_LETTER_TOTAL = "email.dead_letter.total";
  private static final String METRIC_STATUS_REPORT_FAILURE = "email.status_report.failure.total";
  private static final String METRIC_CIRCUIT_STATE = "email.circuit.state";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deadLetterCounters = new ConcurrentHashMap<>();
  private final Counter statusReportFailureCounter;
  private final Timer deliveryE2eDelayTimer;

  public DeliveryMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.statusReportFailureCounter =
        Counter.builder(METRIC_STATUS_REPORT_FAILURE)
            .description("Status callbacks that could not be delivered")
            .register(meterRegistry);
    this.deliveryE2eDelayTimer =
        Timer.builder(METRIC_DELIVERY_E2E_DELAY)
            .description("Delay from first processing attempt to successful delivery")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Email delivery outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDeliveryE2eDelay(Instant createdAt, Instant deliveredAt) {
    if (createdAt == null || deliveredAt == null || deliveredAt.isBefore(createdAt)) {
      return;
    }
    deliveryE2eDelayTimer.record(Duration.between(createdAt, deliveredAt));
  }

  public void recordDeadLetter(boolean published) {
    final String result = published ? "published" : "failed";
    deadLetterCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DEAD_LETTER_TOTAL)
                    .description("Dead-letter publish attempts")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordStatusReportFailure() {
    statusReportFailureCounter.increment();
  }

  public void registerCircuitBreaker(CircuitBreaker breaker) {
    Gauge.builder(METRIC_CIRCUIT_STATE, breaker, b -> b.getState().getOrder())
        .description("Circuit breaker state (0=closed, 1=open, 2=half_open)")
        .tags(Tags.of("name", breaker.getName()))
        .register(meterRegistry);
  }
}
