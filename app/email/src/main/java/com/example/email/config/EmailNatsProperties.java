/*
 * どこで: Email 配信の設定バインド
 * 何を: 配信要求キューと dead-letter の JetStream 設定 (subject/stream/durable/ack-wait/max-deliver/並列数) を保持する
 * なぜ: 再配信の猶予と上限、重複排除窓を環境で調整し、起動時に妥当性を検証するため
 */
package com.example.email.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "email.nats")
@Validated
public record EmailNatsProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable,
    @NotNull Duration duplicateWindow,
    @NotNull Duration ackWait,
    @NotNull @Positive Integer maxDeliver,
    @NotBlank String deadLetterSubject,
    @NotBlank String deadLetterStream,
    @NotNull @Positive Integer concurrency) {

  @AssertTrue(message = "email.nats.duplicate-window must be positive")
  public boolean isDuplicateWindowPositive() {
    return isPositiveDuration(duplicateWindow);
  }

  @AssertTrue(message = "email.nats.ack-wait must be positive")
  public boolean isAckWaitPositive() {
    return isPositiveDuration(ackWait);
  }

  @AssertTrue(message = "email.nats.dead-letter-subject must differ from subject")
  public boolean isDeadLetterSubjectDistinct() {
    // dead-letter を要求 subject に流すと購読側で再処理されてしまう
    return subject == null || deadLetterSubject == null || !subject.equals(deadLetterSubject);
  }

  private boolean isPositiveDuration(Duration duration) {
    // null は @NotNull で検出する前提
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
