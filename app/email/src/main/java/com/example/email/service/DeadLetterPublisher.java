/*
 * どこで: Email 配信サービス層
 * 何を: 恒久的に失敗した配信要求を調査用の宛先へ転送する抽象
 * なぜ: 手動復旧のため元の要求を残すが、転送失敗で処理結果を変えないため
 */
package com.example.email.service;

import com.example.email.model.NotificationPayload;

public interface DeadLetterPublisher {

  /** ベストエフォート。実装は例外を送出してはならない。 */
  void publish(NotificationPayload payload, String reason);
}
