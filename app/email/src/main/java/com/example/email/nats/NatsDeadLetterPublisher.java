/*
 * どこで: Email 配信の NATS 連携
 * 何を: 恒久失敗した配信要求を dead-letter stream へ発行する
 * なぜ: 手動調査/再投入のために元の要求を永続化しつつ、発行失敗で配信結果を変えないため
 */
package com.example.email.nats;

import com.example.email.config.EmailNatsProperties;
import com.example.email.model.NotificationPayload;
import com.example.email.service.DeadLetterPublisher;
import com.example.email.service.DeliveryMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.impl.Headers;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsDeadLetterPublisher implements DeadLetterPublisher {

    static final String HEADER_REASON = "Dead-Letter-Reason";
    static final String MSG_ID_PREFIX = "dead-letter:";
    static final int MAX_HEADER_REASON_LENGTH = 512;

    private static final Logger logger = LoggerFactory.getLogger(NatsDeadLetterPublisher.class);

    private final Connection connection;
    private final EmailNatsProperties properties;
    private final ObjectMapper objectMapper;
    private final DeliveryMetrics metrics;
    private final AtomicBoolean streamReady = new AtomicBoolean(false);

    public NatsDeadLetterPublisher(Connection connection,
            EmailNatsProperties properties,
            ObjectMapper objectMapper,
            DeliveryMetrics metrics) {
        this.connection = connection;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.metrics = metrics;
    }

    @Override
    public void publish(NotificationPayload payload, String reason) {
        try {
            ensureStream();
            final Headers headers = new Headers()
                    .add(JetStreamNotificationQueue.HEADER_MSG_ID, MSG_ID_PREFIX + payload.requestId());
            if (reason != null) {
                headers.add(HEADER_REASON, headerValue(reason));
            }
            connection.jetStream().publish(
                    properties.deadLetterSubject(), headers, objectMapper.writeValueAsBytes(payload));
            metrics.recordDeadLetter(true);
            logger.info("dead letter published requestId={} subject={}",
                    payload.requestId(), properties.deadLetterSubject());
        } catch (IOException | JetStreamApiException | RuntimeException ex) {
            // ベストエフォート: 失敗は記録だけして呼び出し側へは伝えない
            metrics.recordDeadLetter(false);
            logger.error("dead letter publish failed requestId={} reason={}",
                    payload.requestId(), reason, ex);
        }
    }

    /**
     * NATS ヘッダは印字可能な ASCII しか受け付けないため、それ以外の文字を置き換え長さを切り詰める。
     * 元の理由文は配信記録の error 列に残る。
     */
    static String headerValue(String reason) {
        final StringBuilder value = new StringBuilder(Math.min(reason.length(), MAX_HEADER_REASON_LENGTH));
        for (int i = 0; i < reason.length() && value.length() < MAX_HEADER_REASON_LENGTH; i++) {
            final char c = reason.charAt(i);
            if (c >= 0x20 && c <= 0x7e) {
                value.append(c);
            } else if (Character.isWhitespace(c)) {
                value.append(' ');
            } else {
                value.append('?');
            }
        }
        return value.toString();
    }

    private void ensureStream() throws IOException, JetStreamApiException {
        if (streamReady.get()) {
            return;
        }
        JetStreamStreams.upsert(
                connection.jetStreamManagement(),
                JetStreamStreams.configuration(
                        properties.deadLetterStream(),
                        properties.deadLetterSubject(),
                        properties.duplicateWindow()));
        streamReady.set(true);
        logger.info("dead letter stream ensured stream={} subject={}",
                properties.deadLetterStream(), properties.deadLetterSubject());
    }
}
