/*
 * どこで: Email 配信 API
 * 何を: すべての応答を包む共通エンベロープ {success, message, data, error, meta}
 * なぜ: 成功/失敗でクライアントの解析方法を変えずに済むようにするため
 */
package com.example.email.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ApiResponse<T>(boolean success, String message, T data, String error, Object meta) {

  public static <T> ApiResponse<T> ok(String message, T data) {
    return new ApiResponse<>(true, message, data, null, null);
  }

  public static <T> ApiResponse<T> ok(String message, T data, Object meta) {
    return new ApiResponse<>(true, message, data, null, meta);
  }

  public static <T> ApiResponse<T> failure(ApiErrorCode code, String error) {
    return new ApiResponse<>(false, code.message(), null, error, null);
  }
}
