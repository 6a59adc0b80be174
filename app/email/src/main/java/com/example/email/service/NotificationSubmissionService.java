/*
 * どこで: Email 配信サービス層
 * 何を: 検証済みの配信要求について冪等判定を行い、キューへ投入する
 * なぜ: 終端状態の再投入を受付時点で弾き、処理中の重複を二重投入しないため
 */
package com.example.email.service;

import com.example.email.model.NotificationPayload;
import com.example.email.model.NotificationRecord;
import com.example.email.model.NotificationType;
import com.example.email.repository.NotificationRepository;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class NotificationSubmissionService {

  private static final Logger logger = LoggerFactory.getLogger(NotificationSubmissionService.class);

  private final NotificationRepository repository;
  private final NotificationQueue queue;

  public SubmissionResult submit(NotificationPayload payload) {
    if (payload.notificationType() != NotificationType.EMAIL) {
      throw new UnsupportedChannelException(payload.notificationType());
    }
    final Optional<NotificationRecord> existing = repository.findByRequestId(payload.requestId());
    if (existing.isPresent()) {
      final NotificationRecord record = existing.get();
      if (record.status().isTerminal()) {
        throw new NotificationConflictException(record.requestId(), record.status());
      }
      logger.info(
          "duplicate submission while in flight requestId={} status={}",
          record.requestId(),
          record.status());
      return SubmissionResult.inFlight(record.requestId(), record.status());
    }
    queue.enqueue(payload);
    logger.info(
        "notification accepted requestId={} userId={} templateCode={} priority={}",
        payload.requestId(),
        payload.userId(),
        payload.templateCode(),
        payload.priority());
    return SubmissionResult.queued(payload.requestId());
  }
}
