/*
 * どこで: Email 配信の NATS 連携
 * 何を: 配信要求を durable consumer で購読し、配信スレッドプールで処理して Orchestrator の結果に応じて ack/nak/term する
 * なぜ: 再試行の遅延を JetStream の再配信 (nakWithDelay) に任せ、遅い送信が後続の要求を ack-wait 超過させないため
 */
package com.example.email.nats;

import com.example.email.config.EmailNatsProperties;
import com.example.email.config.NatsConfig;
import com.example.email.model.DeliveryOutcome;
import com.example.email.model.NotificationPayload;
import com.example.email.service.DeliveryOrchestrator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class EmailRequestSubscriber {

    private static final Logger logger = LoggerFactory.getLogger(EmailRequestSubscriber.class);

    private final Connection connection;
    private final DeliveryOrchestrator orchestrator;
    private final EmailNatsProperties properties;
    private final ObjectMapper objectMapper;
    private final TaskExecutor deliveryExecutor;
    private final AtomicBoolean started;
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    public EmailRequestSubscriber(Connection connection,
            DeliveryOrchestrator orchestrator,
            EmailNatsProperties properties,
            ObjectMapper objectMapper,
            @Qualifier(NatsConfig.DELIVERY_EXECUTOR) TaskExecutor deliveryExecutor) {
        this.connection = connection;
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.deliveryExecutor = deliveryExecutor;
        this.started = new AtomicBoolean(false);
    }

    @PostConstruct
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            JetStreamStreams.upsert(
                    connection.jetStreamManagement(),
                    JetStreamStreams.configuration(
                            properties.stream(), properties.subject(), properties.duplicateWindow()));
            JetStream jetStream = connection.jetStream();
            dispatcher = connection.createDispatcher();
            subscription = jetStream.subscribe(
                    properties.subject(),
                    dispatcher,
                    this::dispatch,
                    false,
                    buildPushSubscribeOptions());
            logger.info("email request subscriber started subject={} stream={} durable={} concurrency={}",
                    properties.subject(),
                    properties.stream(),
                    properties.durable(),
                    properties.concurrency());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start JetStream subscription", ex);
        }
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.unsubscribe();
            subscription = null;
        }
        if (dispatcher != null) {
            connection.closeDispatcher(dispatcher);
            dispatcher = null;
        }
    }

    @VisibleForTesting
    void dispatch(Message message) {
        try {
            deliveryExecutor.execute(() -> handleMessage(message));
        } catch (TaskRejectedException ex) {
            // 停止中などで受け付けられない場合は他の worker へ再配信させる
            logger.warn("delivery executor rejected email request", ex);
            nakSilently(message, Duration.ZERO);
        }
    }

    @VisibleForTesting
    void handleMessage(Message message) {
        final NotificationPayload payload;
        try {
            payload = objectMapper.readValue(message.getData(), NotificationPayload.class);
        } catch (IOException ex) {
            // payload 破損は再配信で回復しないため恒久的に TERM する
            logger.warn("failed to decode email request payload", ex);
            termSilently(message);
            return;
        }
        if (payload.requestId() == null || payload.requestId().isBlank()) {
            logger.warn("email request without request_id dropped");
            termSilently(message);
            return;
        }

        final DeliveryOutcome outcome;
        try {
            outcome = orchestrator.process(payload);
        } catch (RuntimeException ex) {
            // Orchestrator は例外を返さない前提だが、データロス回避のため再配信に倒す
            logger.error("orchestrator raised unexpectedly requestId={}", payload.requestId(), ex);
            nakSilently(message, Duration.ZERO);
            return;
        }
        if (outcome.requiresRetry()) {
            nakSilently(message, outcome.retryDelay());
        } else {
            ackSilently(message);
        }
    }

    private PushSubscribeOptions buildPushSubscribeOptions() {
        // durable + explicit ack の consumer 設定を組み立てる
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(properties.ackWait())
                .maxDeliver(properties.maxDeliver())
                // 処理スレッド数を超えて受け取ると待ち時間で ack-wait を使い切るため揃える
                .maxAckPending(properties.concurrency())
                .build();
        return PushSubscribeOptions.builder()
                .stream(properties.stream())
                .durable(properties.durable())
                .configuration(consumerConfiguration)
                .build();
    }

    private void ackSilently(Message message) {
        try {
            message.ack();
        } catch (IllegalStateException ex) {
            logger.warn("failed to ack nats message", ex);
        }
    }

    private void nakSilently(Message message, Duration delay) {
        try {
            message.nakWithDelay(delay);
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack nats message", ex);
        }
    }

    private void termSilently(Message message) {
        try {
            message.term();
        } catch (IllegalStateException ex) {
            logger.warn("failed to term nats message", ex);
        }
    }
}
