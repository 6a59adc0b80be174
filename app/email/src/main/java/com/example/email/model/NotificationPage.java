/*
 * どこで: Email 配信ドメインモデル
 * 何を: 一覧取得の 1 ページ分の記録とページング情報
 * なぜ: サービス層から API 層へまとめて渡すため
 */
package com.example.email.model;

import java.util.List;

public record NotificationPage(List<NotificationRecord> records, PaginationMeta meta) {

  public NotificationPage {
    records = List.copyOf(records);
  }
}
