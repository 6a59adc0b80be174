/*
 * どこで: Email 配信の NATS 連携
 * 何を: MaxDeliver advisory を購読し、再配信上限に達した配信要求を stream から取り出して恒久失敗として確定させる
 * なぜ: JetStream が再配信を打ち切った要求も dead-letter と状態通知に必ず到達させるため
 */
package com.example.email.nats;

import com.example.email.config.EmailNatsAdvisoryProperties;
import com.example.email.config.EmailNatsProperties;
import com.example.email.model.DeliveryOutcome;
import com.example.email.model.NotificationPayload;
import com.example.email.service.DeliveryOrchestrator;
import com.fasterxml.jackson.databind.JsonNode;
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
import io.nats.client.api.MessageInfo;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class EmailMaxDeliverAdvisorySubscriber {

    private static final Logger logger = LoggerFactory.getLogger(EmailMaxDeliverAdvisorySubscriber.class);
    private static final int MESSAGE_NOT_FOUND_ERROR = 404;
    private static final int MESSAGE_NOT_FOUND_API_ERROR = 10037;

    private final Connection connection;
    private final EmailNatsProperties natsProperties;
    private final EmailNatsAdvisoryProperties advisoryProperties;
    private final DeliveryOrchestrator orchestrator;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean started;
    private Dispatcher dispatcher;
    private JetStreamSubscription subscription;

    public EmailMaxDeliverAdvisorySubscriber(Connection connection,
            EmailNatsProperties natsProperties,
            EmailNatsAdvisoryProperties advisoryProperties,
            DeliveryOrchestrator orchestrator,
            ObjectMapper objectMapper) {
        this.connection = connection;
        this.natsProperties = natsProperties;
        this.advisoryProperties = advisoryProperties;
        this.orchestrator = orchestrator;
        this.objectMapper = objectMapper;
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
                            advisoryProperties.stream(),
                            advisoryProperties.subject(),
                            natsProperties.duplicateWindow()));
            JetStream jetStream = connection.jetStream();
            dispatcher = connection.createDispatcher();
            subscription = jetStream.subscribe(
                    advisoryProperties.subject(),
                    dispatcher,
                    this::handleMessage,
                    false,
                    buildPushSubscribeOptions());
            logger.info("email advisory subscriber started subject={} stream={} durable={}",
                    advisoryProperties.subject(),
                    advisoryProperties.stream(),
                    advisoryProperties.durable());
        } catch (IOException | JetStreamApiException ex) {
            started.set(false);
            throw new IllegalStateException("failed to start JetStream advisory subscription", ex);
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
    void handleMessage(Message message) {
        final OptionalLong streamSeq = extractStreamSeq(message);
        if (streamSeq.isEmpty()) {
            // stream_seq が取れない advisory は対象を特定できないため破棄する
            logger.warn("advisory payload missing stream_seq subject={}", advisoryProperties.subject());
            ackSilently(message);
            return;
        }
        try {
            final Optional<NotificationPayload> payload = loadRequest(streamSeq.getAsLong());
            if (payload.isEmpty()) {
                ackSilently(message);
                return;
            }
            final DeliveryOutcome outcome = orchestrator.abandon(payload.get(), abandonReason());
            if (outcome.requiresRetry()) {
                nakSilently(message, outcome.retryDelay());
            } else {
                ackSilently(message);
            }
        } catch (IOException | JetStreamApiException ex) {
            // stream 参照の一時障害は advisory の再配信で再試行する
            logger.warn("failed to load abandoned email request streamSeq={}", streamSeq.getAsLong(), ex);
            nakSilently(message, Duration.ZERO);
        } catch (RuntimeException ex) {
            logger.warn("failed to handle advisory payload subject={}", advisoryProperties.subject(), ex);
            nakSilently(message, Duration.ZERO);
        }
    }

    private OptionalLong extractStreamSeq(Message message) {
        final JsonNode payload;
        try {
            payload = objectMapper.readTree(message.getData());
        } catch (IOException ex) {
            logger.warn("failed to parse advisory payload subject={}", advisoryProperties.subject(), ex);
            return OptionalLong.empty();
        }
        JsonNode streamSeqNode = payload.get("stream_seq");
        if (streamSeqNode == null || !streamSeqNode.canConvertToLong()) {
            return OptionalLong.empty();
        }
        long streamSeq = streamSeqNode.asLong();
        if (streamSeq <= 0L) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(streamSeq);
    }

    private Optional<NotificationPayload> loadRequest(long streamSeq)
            throws IOException, JetStreamApiException {
        final MessageInfo stored;
        try {
            stored = connection.jetStreamManagement().getMessage(natsProperties.stream(), streamSeq);
        } catch (JetStreamApiException ex) {
            if (!isMessageNotFound(ex)) {
                throw ex;
            }
            logger.warn("abandoned email request no longer in stream stream={} streamSeq={}",
                    natsProperties.stream(), streamSeq);
            return Optional.empty();
        }
        final NotificationPayload payload;
        try {
            payload = objectMapper.readValue(stored.getData(), NotificationPayload.class);
        } catch (IOException ex) {
            // 配信側でも TERM される破損 payload なので対象外とする
            logger.warn("abandoned email request payload is not decodable streamSeq={}", streamSeq, ex);
            return Optional.empty();
        }
        if (payload.requestId() == null || payload.requestId().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(payload);
    }

    private String abandonReason() {
        return "delivery abandoned after " + natsProperties.maxDeliver() + " queue deliveries";
    }

    private boolean isMessageNotFound(JetStreamApiException ex) {
        return ex.getApiErrorCode() == MESSAGE_NOT_FOUND_API_ERROR
                || ex.getErrorCode() == MESSAGE_NOT_FOUND_ERROR;
    }

    private PushSubscribeOptions buildPushSubscribeOptions() {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                // advisory 側も配信要求と同じ再配信制御値を流用する
                .ackWait(natsProperties.ackWait())
                .maxDeliver(natsProperties.maxDeliver())
                .build();
        return PushSubscribeOptions.builder()
                .stream(advisoryProperties.stream())
                .durable(advisoryProperties.durable())
                .configuration(consumerConfiguration)
                .build();
    }

    private void nakSilently(Message message, Duration delay) {
        try {
            message.nakWithDelay(delay);
        } catch (IllegalStateException ex) {
            logger.warn("failed to nack advisory message", ex);
        }
    }

    private void ackSilently(Message message) {
        try {
            message.ack();
        } catch (IllegalStateException ex) {
            logger.warn("failed to ack advisory message", ex);
        }
    }
}
