/*
 * どこで: Email NATS advisory 購読テスト
 * 何を: MaxDeliver advisory から元の配信要求を取り出して恒久失敗へ確定させる流れと ack/nak を検証する
 * なぜ: 再配信上限で打ち切られた要求が dead-letter に到達することを保証するため
 */
package com.example.email.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.email.config.EmailNatsAdvisoryProperties;
import com.example.email.config.EmailNatsProperties;
import com.example.email.model.DeliveryOutcome;
import com.example.email.model.NotificationPayload;
import com.example.email.service.DeliveryOrchestrator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.Message;
import io.nats.client.api.Error;
import io.nats.client.api.MessageInfo;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EmailMaxDeliverAdvisorySubscriberTest {

  private static final String STREAM = "email-requests";
  private static final String ADVISORY_SUBJECT =
      "$JS.EVENT.ADVISORY.CONSUMER.MAX_DELIVERIES.email-requests.email-service";
  private static final int MAX_DELIVER = 50;
  private static final long STREAM_SEQ = 42L;
  private static final String ADVISORY_JSON =
      """
      {
        "type": "io.nats.jetstream.advisory.v1.max_deliver",
        "stream": "email-requests",
        "consumer": "email-service",
        "stream_seq": 42,
        "deliveries": 50
      }
      """;
  private static final String REQUEST_JSON =
      """
      {"notification_type":"email","user_id":"user-1","template_code":"welcome",
       "variables":{"name":"Ada","email":"ada@example.com"},"request_id":"req-1","priority":10}
      """;

  @Mock private Connection connection;
  @Mock private JetStreamManagement jetStreamManagement;
  @Mock private DeliveryOrchestrator orchestrator;

  @Captor private ArgumentCaptor<NotificationPayload> payloadCaptor;

  private EmailMaxDeliverAdvisorySubscriber subscriber;

  @BeforeEach
  void setUp() {
    final EmailNatsProperties natsProperties =
        new EmailNatsProperties(
            "email.requests",
            STREAM,
            "email-service",
            Duration.ofMinutes(2),
            Duration.ofSeconds(60),
            MAX_DELIVER,
            "email.dead-letter",
            "email-dead-letter",
            4);
    final EmailNatsAdvisoryProperties advisoryProperties =
        new EmailNatsAdvisoryProperties(ADVISORY_SUBJECT, "email-advisory", "email-advisory-consumer");
    subscriber =
        new EmailMaxDeliverAdvisorySubscriber(
            connection, natsProperties, advisoryProperties, orchestrator, new ObjectMapper());
  }

  @Test
  void abandonsStoredRequestAndAcks() throws Exception {
    final Message advisory = messageWith(ADVISORY_JSON);
    stubStoredRequest(REQUEST_JSON);
    when(orchestrator.abandon(payloadCaptor.capture(), anyString()))
        .thenReturn(DeliveryOutcome.permanentlyFailed("delivery abandoned"));

    subscriber.handleMessage(advisory);

    assertThat(payloadCaptor.getValue().requestId()).isEqualTo("req-1");
    assertThat(payloadCaptor.getValue().emailAddress()).isEqualTo("ada@example.com");
    verify(orchestrator)
        .abandon(any(NotificationPayload.class), eq("delivery abandoned after 50 queue deliveries"));
    verify(advisory).ack();
    verify(advisory, never()).nakWithDelay(any(Duration.class));
  }

  @Test
  void naksWithDelayWhileRecordIsStillLeased() throws Exception {
    final Message advisory = messageWith(ADVISORY_JSON);
    stubStoredRequest(REQUEST_JSON);
    when(orchestrator.abandon(any(NotificationPayload.class), anyString()))
        .thenReturn(DeliveryOutcome.retryScheduled(Duration.ofSeconds(30)));

    subscriber.handleMessage(advisory);

    verify(advisory).nakWithDelay(Duration.ofSeconds(30));
    verify(advisory, never()).ack();
  }

  @Test
  void acksWhenStreamSeqMissing() {
    final Message advisory =
        messageWith(
            """
            {"stream": "email-requests", "consumer": "email-service"}
            """);

    subscriber.handleMessage(advisory);

    verify(advisory).ack();
    verifyNoInteractions(orchestrator, connection);
  }

  @Test
  void acksWhenAdvisoryIsNotJson() {
    final Message advisory = messageWith("{broken");

    subscriber.handleMessage(advisory);

    verify(advisory).ack();
    verifyNoInteractions(orchestrator);
  }

  @Test
  void acksWhenStoredRequestIsGone() throws Exception {
    final Message advisory = messageWith(ADVISORY_JSON);
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(jetStreamManagement.getMessage(STREAM, STREAM_SEQ)).thenThrow(new MessageNotFoundException());

    subscriber.handleMessage(advisory);

    verify(advisory).ack();
    verifyNoInteractions(orchestrator);
  }

  @Test
  void naksWhenStreamLookupFails() throws Exception {
    final Message advisory = messageWith(ADVISORY_JSON);
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(jetStreamManagement.getMessage(STREAM, STREAM_SEQ)).thenThrow(new IOException("nats down"));

    subscriber.handleMessage(advisory);

    verify(advisory).nakWithDelay(Duration.ZERO);
    verify(advisory, never()).ack();
    verifyNoInteractions(orchestrator);
  }

  @Test
  void acksWhenStoredRequestHasNoRequestId() throws Exception {
    final Message advisory = messageWith(ADVISORY_JSON);
    stubStoredRequest(
        """
        {"notification_type":"email","user_id":"user-1","template_code":"welcome"}
        """);

    subscriber.handleMessage(advisory);

    verify(advisory).ack();
    verifyNoInteractions(orchestrator);
  }

  private void stubStoredRequest(String json) throws IOException, JetStreamApiException {
    final MessageInfo stored = mock(MessageInfo.class);
    when(stored.getData()).thenReturn(json.getBytes(StandardCharsets.UTF_8));
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(jetStreamManagement.getMessage(STREAM, STREAM_SEQ)).thenReturn(stored);
  }

  private Message messageWith(String json) {
    final Message message = mock(Message.class);
    when(message.getData()).thenReturn(json.getBytes(StandardCharsets.UTF_8));
    return message;
  }

  static final class MessageNotFoundException extends JetStreamApiException {
    MessageNotFoundException() {
      super(Error.JsBadRequestErr);
    }

    @Override
    public int getApiErrorCode() {
      return 10037;
    }

    @Override
    public int getErrorCode() {
      return 404;
    }
  }
}
