/*
 * どこで: Email 配信 API
 * 何を: 例外を共通エンベロープの HTTP レスポンスへ変換する
 * なぜ: 受付時の検証エラー/冪等衝突/キュー障害を一貫した形で返すため
 */
package com.example.email.api;

import com.example.email.model.NotificationStatus;
import com.example.email.service.NotificationConflictException;
import com.example.email.service.NotificationNotFoundException;
import com.example.email.service.QueueUnavailableException;
import com.example.email.service.UnsupportedChannelException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(NotificationConflictException.class)
  public ResponseEntity<ApiResponse<Void>> handleConflict(NotificationConflictException ex) {
    final ApiErrorCode code =
        ex.getStatus() == NotificationStatus.DELIVERED
            ? ApiErrorCode.ALREADY_DELIVERED
            : ApiErrorCode.ALREADY_FAILED;
    return respond(code, ex.getMessage());
  }

  @ExceptionHandler(NotificationNotFoundException.class)
  public ResponseEntity<ApiResponse<Void>> handleNotFound(NotificationNotFoundException ex) {
    return respond(ApiErrorCode.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(UnsupportedChannelException.class)
  public ResponseEntity<ApiResponse<Void>> handleUnsupportedChannel(UnsupportedChannelException ex) {
    return respond(ApiErrorCode.UNSUPPORTED_CHANNEL, ex.getMessage());
  }

  @ExceptionHandler(QueueUnavailableException.class)
  public ResponseEntity<ApiResponse<Void>> handleQueueUnavailable(QueueUnavailableException ex) {
    logger.error("notification queue unavailable", ex);
    return respond(ApiErrorCode.QUEUE_UNAVAILABLE, "notification could not be queued, retry later");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiResponse<Void>> handleIllegalArgument(IllegalArgumentException ex) {
    return respond(ApiErrorCode.VALIDATION_ERROR, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiResponse<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return respond(ApiErrorCode.VALIDATION_ERROR, ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiResponse<Void>> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return respond(ApiErrorCode.VALIDATION_ERROR, message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSON パーサの内部文言は露出しない
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    final String message =
        rawMessage.contains("Required request body is missing")
            ? "request body is required"
            : "request body is invalid";
    return respond(ApiErrorCode.VALIDATION_ERROR, message);
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiResponse<Void>> handleUnexpected(RuntimeException ex) {
    logger.error("unexpected api failure", ex);
    return respond(ApiErrorCode.INTERNAL_ERROR, "unexpected error");
  }

  private ResponseEntity<ApiResponse<Void>> respond(ApiErrorCode code, String error) {
    return ResponseEntity.status(code.status()).body(ApiResponse.failure(code, error));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
