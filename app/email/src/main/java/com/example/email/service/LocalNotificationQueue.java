/*
 * どこで: Email 配信サービス層
 * 何を: NATS 無効時に TaskScheduler 上で配信を実行し、指示された遅延後に再投入する
 * なぜ: ブローカーなしでも配信と再試行の流れを同じ Orchestrator で動かすため
 */
package com.example.email.service;

import com.example.email.model.DeliveryOutcome;
import com.example.email.model.NotificationPayload;
import java.time.Clock;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "nats.enabled", havingValue = "false")
public class LocalNotificationQueue implements NotificationQueue {

  private static final Logger logger = LoggerFactory.getLogger(LocalNotificationQueue.class);

  private final TaskScheduler taskScheduler;
  private final DeliveryOrchestrator orchestrator;
  private final Clock clock;

  @Override
  public void enqueue(NotificationPayload payload) {
    try {
      taskScheduler.schedule(() -> dispatch(payload), clock.instant());
    } catch (TaskRejectedException ex) {
      throw new QueueUnavailableException("local scheduler rejected requestId=" + payload.requestId(), ex);
    }
    logger.info("notification queued locally requestId={}", payload.requestId());
  }

  void dispatch(NotificationPayload payload) {
    final DeliveryOutcome outcome = orchestrator.process(payload);
    if (!outcome.requiresRetry()) {
      return;
    }
    try {
      taskScheduler.schedule(() -> dispatch(payload), clock.instant().plus(outcome.retryDelay()));
    } catch (TaskRejectedException ex) {
      // シャットダウン中などで再投入できない場合、記録は PENDING のまま残る
      logger.warn("local retry could not be scheduled requestId={}", payload.requestId(), ex);
    }
  }
}
