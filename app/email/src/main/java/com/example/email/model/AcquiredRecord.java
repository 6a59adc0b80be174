/*
 * どこで: Email 配信ドメインモデル
 * 何を: create-or-get の結果 (既存か新規か) を表す
 * なぜ: 重複作成の競合を呼び出し側で区別できるようにするため
 */
package com.example.email.model;

public record AcquiredRecord(NotificationRecord record, boolean created) {}
