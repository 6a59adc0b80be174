/*
 * どこで: Email 配信の NATS 連携
 * 何を: JetStream stream を冪等に作成/更新する
 * なぜ: 起動順や再起動に関係なく、Nats-Msg-Id の重複排除窓を持つ stream を必ず用意するため
 */
package com.example.email.nats;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.StreamConfiguration;
import java.io.IOException;
import java.time.Duration;

final class JetStreamStreams {

    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

    private JetStreamStreams() {}

    static StreamConfiguration configuration(String stream, String subject, Duration duplicateWindow) {
        return StreamConfiguration.builder()
                .name(stream)
                .subjects(subject)
                .duplicateWindow(duplicateWindow)
                .build();
    }

    static void upsert(JetStreamManagement jetStreamManagement, StreamConfiguration configuration)
            throws IOException, JetStreamApiException {
        try {
            jetStreamManagement.updateStream(configuration);
        } catch (JetStreamApiException ex) {
            if (!isStreamNotFound(ex)) {
                throw ex;
            }
            jetStreamManagement.addStream(configuration);
        }
    }

    private static boolean isStreamNotFound(JetStreamApiException ex) {
        return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
                || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
    }
}
