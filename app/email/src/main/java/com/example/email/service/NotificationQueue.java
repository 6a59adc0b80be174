/*
 * どこで: Email 配信サービス層
 * 何を: 配信要求を非同期処理キューへ投入する抽象
 * なぜ: JetStream とプロセス内スケジューラを切り替えるため
 */
package com.example.email.service;

import com.example.email.model.NotificationPayload;

public interface NotificationQueue {

  /**
   * @throws QueueUnavailableException キューへ投入できなかった場合
   */
  void enqueue(NotificationPayload payload);
}
