/*
 * どこで: Email 配信サービス層
 * 何を: NATS 無効時に dead-letter 対象をログへ残す
 * なぜ: ブローカーなしのローカル環境でも失敗要求を追跡できるようにするため
 */
package com.example.email.service;

import com.example.email.model.NotificationPayload;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LocalDeadLetterPublisher implements DeadLetterPublisher {

  private static final Logger logger = LoggerFactory.getLogger(LocalDeadLetterPublisher.class);

  private final DeliveryMetrics metrics;

  @Override
  public void publish(NotificationPayload payload, String reason) {
    logger.error(
        "dead letter recorded requestId={} userId={} templateCode={} reason={}",
        payload.requestId(),
        payload.userId(),
        payload.templateCode(),
        reason);
    metrics.recordDeadLetter(true);
  }
}
