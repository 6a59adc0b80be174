/*
 * どこで: Email 配信の NATS 連携
 * 何を: 配信要求を JetStream の要求 subject へ発行する
 * なぜ: request_id を Nats-Msg-Id にして、重複排除窓内の二重投入をブローカー側で吸収するため
 */
package com.example.email.nats;

import com.example.email.config.EmailNatsProperties;
import com.example.email.model.NotificationPayload;
import com.example.email.service.NotificationQueue;
import com.example.email.service.QueueUnavailableException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.nats.client.Connection;
import io.nats.client.JetStreamApiException;
import io.nats.client.api.PublishAck;
import io.nats.client.impl.Headers;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class JetStreamNotificationQueue implements NotificationQueue {

    static final String HEADER_MSG_ID = "Nats-Msg-Id";

    private static final Logger logger = LoggerFactory.getLogger(JetStreamNotificationQueue.class);

    private final Connection connection;
    private final EmailNatsProperties properties;
    private final ObjectMapper objectMapper;

    public JetStreamNotificationQueue(
            Connection connection, EmailNatsProperties properties, ObjectMapper objectMapper) {
        this.connection = connection;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void ensureStream() {
        try {
            JetStreamStreams.upsert(
                    connection.jetStreamManagement(),
                    JetStreamStreams.configuration(
                            properties.stream(), properties.subject(), properties.duplicateWindow()));
            logger.info("request stream ensured stream={} subject={} duplicateWindow={}",
                    properties.stream(),
                    properties.subject(),
                    properties.duplicateWindow());
        } catch (IOException | JetStreamApiException ex) {
            throw new IllegalStateException("failed to ensure request stream", ex);
        }
    }

    @Override
    public void enqueue(NotificationPayload payload) {
        final byte[] data;
        try {
            data = objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("payload could not be serialized", ex);
        }
        final Headers headers = new Headers().add(HEADER_MSG_ID, payload.requestId());
        try {
            final PublishAck ack = connection.jetStream().publish(properties.subject(), headers, data);
            logger.info("notification published requestId={} stream={} seq={} duplicate={}",
                    payload.requestId(),
                    ack.getStream(),
                    ack.getSeqno(),
                    ack.isDuplicate());
        } catch (IOException | JetStreamApiException ex) {
            throw new QueueUnavailableException(
                    "failed to publish notification requestId=" + payload.requestId(), ex);
        }
    }
}
