/*
 * どこで: Email 配信設定
 * 何を: 宛先 (variables.email) 欠落時の扱いを選ぶポリシー
 * なぜ: 再試行しても直らない入力を即時失敗にするか、従来どおり再試行枠を消費させるかを選べるようにするため
 */
package com.example.email.config;

public enum MissingAddressPolicy {
  /** 再試行せずに即 failed とし DLQ へ送る。 */
  PERMANENT,
  /** 一時失敗として扱い、最大試行回数まで再試行する。 */
  RETRY
}
