/*
 * どこで: Email 配信サービス層
 * 何を: 1 件の配信要求について冪等判定/記録確保/テンプレート取得/送信/再試行判定/dead-letter 送出を行う
 * なぜ: 配信の状態遷移と再試行方針を 1 か所に集約し、結果を DeliveryOutcome としてスケジューラへ返すため
 */
package com.example.email.service;

import com.example.common.ErrorMessages;
import com.example.common.HostNames;
import com.example.email.config.EmailDeliveryProperties;
import com.example.email.config.MissingAddressPolicy;
import com.example.email.config.ResilienceConfig;
import com.example.email.model.AcquiredRecord;
import com.example.email.model.DeliveryOutcome;
import com.example.email.model.NotificationPayload;
import com.example.email.model.NotificationRecord;
import com.example.email.model.NotificationStatus;
import com.example.email.repository.NotificationRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * 配信要求 1 件を処理する。
 *
 * <p>{@link #process} は例外を送出しない。依存先の失敗、永続化の失敗、想定外の例外はすべて {@link
 * DeliveryOutcome} に変換される。記録の書き込みは lease を保持した呼び出しだけが成功するため、同じ request_id
 * が並行して配信されても failed への遷移と dead-letter 送出は 1 回に限られる。
 */
@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "依存はすべて Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class DeliveryOrchestrator {

  private static final Logger logger = LoggerFactory.getLogger(DeliveryOrchestrator.class);

  static final String MISSING_ADDRESS_ERROR = "recipient email address is missing";

  private final NotificationRepository repository;
  private final TemplateClient templateClient;
  private final TemplateRenderer renderer;
  private final MailTransport mailTransport;
  private final DeadLetterPublisher deadLetterPublisher;
  private final StatusReporter statusReporter;
  private final DeliveryMetrics metrics;
  private final EmailDeliveryProperties properties;
  private final CircuitBreaker templateBreaker;
  private final CircuitBreaker transportBreaker;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String workerId;

  public DeliveryOrchestrator(
      NotificationRepository repository,
      TemplateClient templateClient,
      TemplateRenderer renderer,
      MailTransport mailTransport,
      DeadLetterPublisher deadLetterPublisher,
      StatusReporter statusReporter,
      DeliveryMetrics metrics,
      EmailDeliveryProperties properties,
      @Qualifier(ResilienceConfig.TEMPLATE_BREAKER) CircuitBreaker templateBreaker,
      @Qualifier(ResilienceConfig.TRANSPORT_BREAKER) CircuitBreaker transportBreaker,
      ObjectMapper objectMapper,
      Clock clock) {
    this.repository = repository;
    this.templateClient = templateClient;
    this.renderer = renderer;
    this.mailTransport = mailTransport;
    this.deadLetterPublisher = deadLetterPublisher;
    this.statusReporter = statusReporter;
    this.metrics = metrics;
    this.properties = properties;
    this.templateBreaker = templateBreaker;
    this.transportBreaker = transportBreaker;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.workerId = HostNames.resolve();
  }

  public DeliveryOutcome process(NotificationPayload payload) {
    return withinRequest(payload, "delivering", () -> doProcess(payload));
  }

  /**
   * キューが再配信上限に達して配信を打ち切った要求を、送信せずに恒久失敗として確定させる。
   *
   * <p>通常の配信と同じ lease を取得してから failed を書くため、dead-letter 送出は request_id ごとに 1 回に限られる。
   * 記録が既に終端なら何もしない。lease を他の worker が保持している場合は再試行の結果を返す。
   */
  public DeliveryOutcome abandon(NotificationPayload payload, String reason) {
    return withinRequest(payload, "abandoning", () -> doAbandon(payload, reason));
  }

  private DeliveryOutcome withinRequest(
      NotificationPayload payload, String action, Supplier<DeliveryOutcome> body) {
    MDC.put("request_id", payload.requestId());
    MDC.put("correlation_id", payload.correlationId());
    try {
      return body.get();
    } catch (DataAccessException ex) {
      logger.warn("persistence failure while {} requestId={}", action, payload.requestId(), ex);
      return retryAfter(properties.persistenceRetryDelay());
    } catch (RuntimeException ex) {
      logger.error("unexpected failure while {} requestId={}", action, payload.requestId(), ex);
      return retryAfter(properties.persistenceRetryDelay());
    } finally {
      MDC.remove("request_id");
      MDC.remove("correlation_id");
    }
  }

  private DeliveryOutcome doProcess(NotificationPayload payload) {
    final DeliveryOutcome settled = settledOutcome(payload.requestId());
    if (settled != null) {
      return settled;
    }
    final String lockedBy = newLockOwner();
    final Acquisition acquisition = acquire(payload, lockedBy, clock.instant());
    if (acquisition.outcome() != null) {
      return acquisition.outcome();
    }
    return deliver(payload, acquisition.record(), lockedBy);
  }

  private DeliveryOutcome doAbandon(NotificationPayload payload, String reason) {
    final DeliveryOutcome settled = settledOutcome(payload.requestId());
    if (settled != null) {
      return settled;
    }
    final String lockedBy = newLockOwner();
    final Acquisition acquisition = acquire(payload, lockedBy, clock.instant());
    if (acquisition.outcome() != null) {
      return acquisition.outcome();
    }
    logger.warn("abandoning notification requestId={} reason={}", payload.requestId(), reason);
    return failPermanently(payload, acquisition.record(), lockedBy, reason);
  }

  private DeliveryOutcome settledOutcome(String requestId) {
    final Optional<NotificationRecord> existing = repository.findByRequestId(requestId);
    return existing.map(this::terminalOutcome).orElse(null);
  }

  // 同一ホスト内の並行配信も区別できるよう、試行ごとに lease 所有者を発行する
  private String newLockOwner() {
    return workerId + "/" + UUID.randomUUID();
  }

  private Acquisition acquire(NotificationPayload payload, String lockedBy, Instant now) {
    final Instant leaseUntil = now.plus(properties.lease());
    final AcquiredRecord acquired =
        repository.createOrGet(newRecord(payload, lockedBy, leaseUntil, now));
    if (acquired.created()) {
      return Acquisition.of(acquired.record());
    }
    final DeliveryOutcome terminal = terminalOutcome(acquired.record());
    if (terminal != null) {
      return Acquisition.finished(terminal);
    }
    final Optional<NotificationRecord> claimed =
        repository.claim(payload.requestId(), now, leaseUntil, lockedBy);
    if (claimed.isPresent()) {
      return Acquisition.of(claimed.get());
    }
    // claim 失敗の間に他 worker が終端へ進めた可能性があるため読み直す
    final Optional<NotificationRecord> current = repository.findByRequestId(payload.requestId());
    if (current.isPresent()) {
      final DeliveryOutcome settled = terminalOutcome(current.get());
      if (settled != null) {
        return Acquisition.finished(settled);
      }
    }
    logger.info("notification is being processed by another worker requestId={}", payload.requestId());
    return Acquisition.finished(retryAfter(properties.inFlightRetryDelay()));
  }

  private DeliveryOutcome deliver(
      NotificationPayload payload, NotificationRecord record, String lockedBy) {
    final String body = renderer.render(fetchTemplate(payload.templateCode()), payload.variables());

    final String to = payload.emailAddress();
    if (to == null) {
      logger.warn(
          "recipient address missing requestId={} policy={}",
          payload.requestId(),
          properties.missingAddressPolicy());
      if (properties.missingAddressPolicy() == MissingAddressPolicy.PERMANENT) {
        return failPermanently(payload, record, lockedBy, MISSING_ADDRESS_ERROR);
      }
      return handleFailure(payload, record, lockedBy, MISSING_ADDRESS_ERROR);
    }

    final MailMessage message = new MailMessage(to, payload.subject(), body, isHtml(body));
    try {
      transportBreaker.executeRunnable(() -> mailTransport.send(message));
    } catch (CallNotPermittedException ex) {
      logger.info("transport circuit open requestId={} breaker={}", payload.requestId(), ex.getCausingCircuitBreakerName());
      return handleFailure(payload, record, lockedBy, ex.getMessage());
    } catch (RuntimeException ex) {
      logger.warn("mail send failed requestId={} error={}", payload.requestId(), ex.toString());
      return handleFailure(payload, record, lockedBy, ErrorMessages.describe(ex));
    }
    return markDelivered(record, lockedBy);
  }

  private String fetchTemplate(String templateCode) {
    try {
      return templateBreaker.executeSupplier(() -> templateClient.fetchTemplate(templateCode));
    } catch (CallNotPermittedException ex) {
      logger.info("template circuit open, using fallback templateCode={}", templateCode);
    } catch (RuntimeException ex) {
      logger.warn(
          "template fetch failed, using fallback templateCode={} error={}",
          templateCode,
          ex.toString());
    }
    return properties.fallbackTemplate();
  }

  private DeliveryOutcome markDelivered(NotificationRecord record, String lockedBy) {
    final Instant now = clock.instant();
    final NotificationRecord delivered =
        record.completeAttempt(NotificationStatus.DELIVERED, null, now);
    if (repository.update(delivered, lockedBy) == 0) {
      // 送信済みだが記録できなかった。再配信時に再送される (at-least-once)
      logger.warn("lease lost after send requestId={}", record.requestId());
      return retryAfter(properties.inFlightRetryDelay());
    }
    logger.info("notification delivered requestId={} attempts={}", record.requestId(), delivered.attempts());
    metrics.recordDeliveryResult(DeliveryMetrics.RESULT_DELIVERED);
    metrics.recordDeliveryE2eDelay(record.createdAt(), now);
    statusReporter.report(record.requestId(), NotificationStatus.DELIVERED, null);
    return DeliveryOutcome.delivered();
  }

  private DeliveryOutcome handleFailure(
      NotificationPayload payload, NotificationRecord record, String lockedBy, String reason) {
    final int nextAttempt = record.attempts() + 1;
    if (nextAttempt >= properties.maxAttempts()) {
      return failPermanently(payload, record, lockedBy, reason);
    }
    final String error = ErrorMessages.truncate(reason, properties.errorMessageMaxLength());
    final NotificationRecord pending =
        record.completeAttempt(NotificationStatus.PENDING, error, clock.instant());
    if (repository.update(pending, lockedBy) == 0) {
      logger.warn("lease lost before retry could be recorded requestId={}", record.requestId());
      return retryAfter(properties.inFlightRetryDelay());
    }
    final Duration delay = computeBackoff(nextAttempt);
    logger.info(
        "notification retry scheduled requestId={} attempts={} delay={} error={}",
        record.requestId(),
        nextAttempt,
        delay,
        error);
    metrics.recordDeliveryResult(DeliveryMetrics.RESULT_RETRY);
    return DeliveryOutcome.retryScheduled(delay);
  }

  private DeliveryOutcome failPermanently(
      NotificationPayload payload, NotificationRecord record, String lockedBy, String reason) {
    final String error = ErrorMessages.truncate(reason, properties.errorMessageMaxLength());
    final NotificationRecord failed =
        record.completeAttempt(NotificationStatus.FAILED, error, clock.instant());
    if (repository.update(failed, lockedBy) == 0) {
      // failed を書けた worker だけが dead-letter を送る
      logger.warn("lease lost before failure could be recorded requestId={}", record.requestId());
      return retryAfter(properties.inFlightRetryDelay());
    }
    logger.error(
        "notification permanently failed requestId={} attempts={} error={}",
        record.requestId(),
        failed.attempts(),
        error);
    metrics.recordDeliveryResult(DeliveryMetrics.RESULT_FAILED);
    deadLetterPublisher.publish(payload, error);
    statusReporter.report(record.requestId(), NotificationStatus.FAILED, error);
    return DeliveryOutcome.permanentlyFailed(error);
  }

  private DeliveryOutcome terminalOutcome(NotificationRecord record) {
    if (record.status() == NotificationStatus.DELIVERED) {
      logger.info("notification already delivered requestId={}", record.requestId());
      metrics.recordDeliveryResult(DeliveryMetrics.RESULT_ALREADY_DELIVERED);
      return DeliveryOutcome.alreadyDelivered();
    }
    if (record.status().isTerminal()) {
      logger.info(
          "notification already in terminal state requestId={} status={}",
          record.requestId(),
          record.status());
      return DeliveryOutcome.permanentlyFailed(record.error());
    }
    return null;
  }

  private NotificationRecord newRecord(
      NotificationPayload payload, String lockedBy, Instant leaseUntil, Instant now) {
    return new NotificationRecord(
        payload.requestId(),
        payload.userId(),
        payload.emailAddress(),
        payload.templateCode(),
        toJson(payload),
        NotificationStatus.PROCESSING,
        0,
        null,
        lockedBy,
        leaseUntil,
        now,
        now);
  }

  private String toJson(NotificationPayload payload) {
    try {
      return objectMapper.writeValueAsString(payload.variables());
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException(
          "variables could not be serialized requestId=" + payload.requestId(), ex);
    }
  }

  @VisibleForTesting
  Duration computeBackoff(int attempts) {
    // base * exponentBase^attempts を backoffMax で頭打ちにする
    final double millis =
        properties.backoffBase().toMillis() * Math.pow(properties.backoffExponentBase(), attempts);
    final long maxMillis = properties.backoffMax().toMillis();
    if (Double.isNaN(millis) || Double.isInfinite(millis) || millis >= maxMillis) {
      return properties.backoffMax();
    }
    return Duration.ofMillis((long) millis);
  }

  private boolean isHtml(String body) {
    return body.toLowerCase(Locale.ROOT).contains("<html");
  }

  private DeliveryOutcome retryAfter(Duration delay) {
    metrics.recordDeliveryResult(DeliveryMetrics.RESULT_RETRY);
    return DeliveryOutcome.retryScheduled(delay);
  }

  private record Acquisition(NotificationRecord record, DeliveryOutcome outcome) {

    static Acquisition of(NotificationRecord record) {
      return new Acquisition(record, null);
    }

    static Acquisition finished(DeliveryOutcome outcome) {
      return new Acquisition(null, outcome);
    }
  }
}
