/*
 * どこで: Email 配信の統合テスト
 * 何を: 失敗注入された宛先が最大試行回数で FAILED になり、dead-letter が 1 回だけ発行されることを検証する
 * なぜ: 実 DB の条件付き更新と Orchestrator の分岐を通しで保証するため
 */
package com.example.email.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.email.AbstractPostgresContainerTest;
import com.example.email.TestFixtures;
import com.example.email.model.DeliveryOutcome;
import com.example.email.model.NotificationPayload;
import com.example.email.model.NotificationRecord;
import com.example.email.model.NotificationStatus;
import com.example.email.repository.NotificationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

// 失敗注入でブレーカーが開くと試行回数が数えられないため、閾値を上げておく
@SpringBootTest(properties = "email.circuit-breaker.transport.failure-threshold=100")
@ActiveProfiles("test")
class DeadLetterFlowIntegrationTest extends AbstractPostgresContainerTest {

  @Autowired private DeliveryOrchestrator orchestrator;
  @Autowired private NotificationRepository repository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @MockitoBean private DeadLetterPublisher deadLetterPublisher;
  @MockitoBean private TemplateClient templateClient;

  @BeforeEach
  void setUp() {
    jdbcTemplate.update("DELETE FROM notifications", new MapSqlParameterSource());
    when(templateClient.fetchTemplate(anyString())).thenReturn("Hello {name}");
  }

  @Test
  void injectedFailuresEndInFailedWithSingleDeadLetter() {
    final NotificationPayload payload = TestFixtures.payload("req-dlq", "fail-ada@example.com");

    DeliveryOutcome outcome = orchestrator.process(payload);
    int rounds = 1;
    while (outcome.requiresRetry() && rounds < 10) {
      // 再試行待ちの記録は PENDING なので、遅延を待たずに次の試行を行える
      outcome = orchestrator.process(payload);
      rounds++;
    }

    assertThat(outcome.kind()).isEqualTo(DeliveryOutcome.Kind.PERMANENTLY_FAILED);
    assertThat(rounds).isEqualTo(5);
    final NotificationRecord record = repository.findByRequestId("req-dlq").orElseThrow();
    assertThat(record.status()).isEqualTo(NotificationStatus.FAILED);
    assertThat(record.attempts()).isEqualTo(5);
    assertThat(record.error()).contains("failure injection");

    orchestrator.process(payload);

    verify(deadLetterPublisher, times(1))
        .publish(argThat(p -> p.requestId().equals("req-dlq")), contains("failure injection"));
  }

  @Test
  void normalAddressIsDeliveredWithoutDeadLetter() {
    final DeliveryOutcome outcome =
        orchestrator.process(TestFixtures.payload("req-ok", "ada@example.com"));

    assertThat(outcome.kind()).isEqualTo(DeliveryOutcome.Kind.DELIVERED);
    final NotificationRecord record = repository.findByRequestId("req-ok").orElseThrow();
    assertThat(record.status()).isEqualTo(NotificationStatus.DELIVERED);
    assertThat(record.toAddress()).isEqualTo("ada@example.com");
    verifyNoInteractions(deadLetterPublisher);
  }
}
