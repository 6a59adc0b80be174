/*
 * どこで: 共通ユーティリティ
 * 何を: 例外メッセージを保存可能な長さへ切り詰める
 * なぜ: error カラムやヘッダへ巨大なスタック由来の文言を載せないため
 */
package com.example.common;

public final class ErrorMessages {

  public static final String UNKNOWN_ERROR = "unknown error";

  private ErrorMessages() {}

  public static String truncate(String message, int maxLength) {
    if (maxLength <= 0) {
      throw new IllegalArgumentException("maxLength must be positive");
    }
    if (message == null || message.isBlank()) {
      return UNKNOWN_ERROR;
    }
    if (message.length() <= maxLength) {
      return message;
    }
    return message.substring(0, maxLength);
  }

  // cause を辿って最初に見つかった非空メッセージを使う
  public static String describe(Throwable throwable) {
    Throwable current = throwable;
    while (current != null) {
      final String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        return message;
      }
      current = current.getCause();
    }
    return throwable == null ? UNKNOWN_ERROR : throwable.getClass().getSimpleName();
  }
}
