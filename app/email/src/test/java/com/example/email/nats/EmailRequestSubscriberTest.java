/*
 * どこで: Email NATS JetStream 購読テスト(統合寄り)
 * 何を: start() 経由で配信スレッドプールへ handleMessage が配線されることと ack/nak/term の分岐を検証する
 * なぜ: 配信結果に応じた再配信制御が JetStream へ正しく伝わることを保証するため
 */
package com.example.email.nats;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.email.config.EmailNatsProperties;
import com.example.email.model.DeliveryOutcome;
import com.example.email.model.NotificationPayload;
import com.example.email.service.DeliveryOrchestrator;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.Error;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@ExtendWith(MockitoExtension.class)
class EmailRequestSubscriberTest {

    private static final String SUBJECT = "email.requests";
    private static final String STREAM = "email-requests";
    private static final String DURABLE = "email-service";
    private static final Duration DUPLICATE_WINDOW = Duration.ofMinutes(2);
    private static final Duration ACK_WAIT = Duration.ofSeconds(60);
    private static final int MAX_DELIVER = 50;
    private static final int CONCURRENCY = 4;
    private static final String REQUEST_JSON = """
            {"notification_type":"email","user_id":"user-1","template_code":"welcome",
             "variables":{"name":"Ada","email":"ada@example.com"},"request_id":"req-1","priority":10}
            """;

    @Mock
    private Connection connection;

    @Mock
    private JetStream jetStream;

    @Mock
    private JetStreamManagement jetStreamManagement;

    @Mock
    private Dispatcher dispatcher;

    @Mock
    private JetStreamSubscription subscription;

    @Mock
    private DeliveryOrchestrator orchestrator;

    @Captor
    private ArgumentCaptor<MessageHandler> handlerCaptor;

    @Captor
    private ArgumentCaptor<PushSubscribeOptions> optionsCaptor;

    private EmailRequestSubscriber subscriber;

    @BeforeEach
    void setUp() {
        subscriber = newSubscriber(new SyncTaskExecutor());
    }

    @Test
    void ackWhenDelivered() throws Exception {
        Message message = messageWith(REQUEST_JSON);
        stubSubscribe();
        when(orchestrator.process(any(NotificationPayload.class))).thenReturn(DeliveryOutcome.delivered());

        subscriber.start();

        // JetStream から受け取ったメッセージを handler 経由で処理する
        handlerCaptor.getValue().onMessage(message);

        verify(message).ack();
        verify(message, never()).nakWithDelay(any(Duration.class));
    }

    @Test
    void ackWhenPermanentlyFailed() throws Exception {
        Message message = messageWith(REQUEST_JSON);
        stubSubscribe();
        when(orchestrator.process(any(NotificationPayload.class)))
                .thenReturn(DeliveryOutcome.permanentlyFailed("smtp down"));

        subscriber.start();
        handlerCaptor.getValue().onMessage(message);

        verify(message).ack();
        verify(message, never()).term();
    }

    @Test
    void nakWithBackoffWhenRetryScheduled() throws Exception {
        Message message = messageWith(REQUEST_JSON);
        stubSubscribe();
        when(orchestrator.process(any(NotificationPayload.class)))
                .thenReturn(DeliveryOutcome.retryScheduled(Duration.ofSeconds(4)));

        subscriber.start();
        handlerCaptor.getValue().onMessage(message);

        verify(message).nakWithDelay(Duration.ofSeconds(4));
        verify(message, never()).ack();
    }

    @Test
    void nakImmediatelyWhenOrchestratorThrows() throws Exception {
        Message message = messageWith(REQUEST_JSON);
        stubSubscribe();
        when(orchestrator.process(any(NotificationPayload.class)))
                .thenThrow(new IllegalStateException("boom"));

        subscriber.start();
        handlerCaptor.getValue().onMessage(message);

        verify(message).nakWithDelay(Duration.ZERO);
        verify(message, never()).ack();
    }

    @Test
    void swallowExceptionWhenNakFails() throws Exception {
        Message message = messageWith(REQUEST_JSON);
        stubSubscribe();
        when(orchestrator.process(any(NotificationPayload.class)))
                .thenReturn(DeliveryOutcome.retryScheduled(Duration.ofSeconds(1)));
        doThrow(new IllegalStateException("nak-failed")).when(message).nakWithDelay(any(Duration.class));

        subscriber.start();

        assertDoesNotThrow(() -> handlerCaptor.getValue().onMessage(message));
        verify(message, never()).ack();
    }

    @Test
    void termWhenPayloadParseFails() throws Exception {
        Message message = messageWith("{not-json");
        stubSubscribe();

        subscriber.start();
        handlerCaptor.getValue().onMessage(message);

        verify(message).term();
        verify(message, never()).ack();
        verifyNoInteractions(orchestrator);
    }

    @Test
    void termWhenRequestIdMissing() throws Exception {
        Message message = messageWith("""
                {"notification_type":"email","user_id":"user-1","template_code":"welcome"}
                """);
        stubSubscribe();

        subscriber.start();
        handlerCaptor.getValue().onMessage(message);

        verify(message).term();
        verifyNoInteractions(orchestrator);
    }

    @Test
    void startCreatesStreamWhenMissing() throws Exception {
        stubSubscribe();
        when(jetStreamManagement.updateStream(any(StreamConfiguration.class)))
                .thenThrow(new StreamNotFoundException());

        subscriber.start();

        verify(jetStreamManagement).updateStream(any(StreamConfiguration.class));
        verify(jetStreamManagement).addStream(any(StreamConfiguration.class));
    }

    @Test
    void startUsesDurableAckWaitAndMaxDeliver() throws Exception {
        stubConnection();
        when(jetStream.subscribe(eq(SUBJECT), eq(dispatcher), any(MessageHandler.class), eq(false),
                optionsCaptor.capture()))
                .thenReturn(subscription);

        subscriber.start();

        PushSubscribeOptions options = optionsCaptor.getValue();
        assertEquals(DURABLE, options.getDurable());
        assertEquals(ACK_WAIT, options.getConsumerConfiguration().getAckWait());
        assertEquals(MAX_DELIVER, options.getConsumerConfiguration().getMaxDeliver());
        assertEquals(CONCURRENCY, options.getConsumerConfiguration().getMaxAckPending());
    }

    @Test
    void slowDeliveryDoesNotBlockNextMessage() throws Exception {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.initialize();
        try {
            EmailRequestSubscriber parallel = newSubscriber(executor);
            CountDownLatch bothStarted = new CountDownLatch(2);
            CountDownLatch release = new CountDownLatch(1);
            when(orchestrator.process(any(NotificationPayload.class))).thenAnswer(invocation -> {
                bothStarted.countDown();
                release.await(5, TimeUnit.SECONDS);
                return DeliveryOutcome.delivered();
            });
            Message first = messageWith(REQUEST_JSON);
            Message second = messageWith(REQUEST_JSON.replace("req-1", "req-2"));

            // dispatcher スレッドは処理完了を待たずに次のメッセージを受け取れる
            parallel.dispatch(first);
            parallel.dispatch(second);

            assertTrue(bothStarted.await(5, TimeUnit.SECONDS));
            release.countDown();
            verify(first, timeout(5000)).ack();
            verify(second, timeout(5000)).ack();
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void nakImmediatelyWhenDeliveryExecutorRejects() {
        TaskExecutor rejecting = task -> {
            throw new TaskRejectedException("delivery executor is shutting down");
        };
        EmailRequestSubscriber stopping = newSubscriber(rejecting);
        Message message = mock(Message.class);

        stopping.dispatch(message);

        verify(message).nakWithDelay(Duration.ZERO);
        verify(message, never()).ack();
        verifyNoInteractions(orchestrator);
    }

    @Test
    void stopClosesSubscriptionAndDispatcherOnce() throws Exception {
        stubSubscribe();

        subscriber.start();

        assertDoesNotThrow(subscriber::stop);
        assertDoesNotThrow(subscriber::stop);

        verify(subscription, times(1)).unsubscribe();
        verify(connection, times(1)).closeDispatcher(dispatcher);
    }

    private EmailRequestSubscriber newSubscriber(TaskExecutor executor) {
        EmailNatsProperties properties = new EmailNatsProperties(SUBJECT, STREAM, DURABLE,
                DUPLICATE_WINDOW, ACK_WAIT, MAX_DELIVER, "email.dead-letter", "email-dead-letter", CONCURRENCY);
        return new EmailRequestSubscriber(connection, orchestrator, properties, new ObjectMapper(), executor);
    }

    private Message messageWith(String json) {
        Message message = mock(Message.class);
        when(message.getData()).thenReturn(json.getBytes(StandardCharsets.UTF_8));
        return message;
    }

    private void stubSubscribe() throws IOException, JetStreamApiException {
        stubConnection();
        when(jetStream.subscribe(eq(SUBJECT), eq(dispatcher), handlerCaptor.capture(), eq(false),
                any(PushSubscribeOptions.class)))
                .thenReturn(subscription);
    }

    private void stubConnection() throws IOException {
        when(connection.jetStream()).thenReturn(jetStream);
        when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
        when(connection.createDispatcher()).thenReturn(dispatcher);
    }

    static final class StreamNotFoundException extends JetStreamApiException {
        StreamNotFoundException() {
            super(Error.JsBadRequestErr);
        }

        @Override
        public int getApiErrorCode() {
            return 10059;
        }

        @Override
        public int getErrorCode() {
            return 404;
        }
    }
}
