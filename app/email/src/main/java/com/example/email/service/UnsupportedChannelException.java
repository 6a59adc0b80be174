/*
 * どこで: Email 配信サービス層
 * 何を: 未対応の通知チャネル (push) が指定されたことを表す例外
 * なぜ: 拡張点として受け口だけを残し、受付時点で明示的に拒否するため
 */
package com.example.email.service;

import com.example.email.model.NotificationType;

public class UnsupportedChannelException extends RuntimeException {

  public UnsupportedChannelException(NotificationType type) {
    super("notification_type '" + type.value() + "' is not supported by this service");
  }
}
