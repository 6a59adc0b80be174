/*
 * どこで: Email 配信サービス層
 * 何を: 配信状態 (delivered/failed) をコールバック URL へ POST する
 * なぜ: 呼び出し元へ結果を伝えるが、その失敗で配信結果を変えないため
 */
package com.example.email.service;

import com.example.email.config.RestClientConfig;
import com.example.email.config.StatusCallbackProperties;
import com.example.email.model.NotificationStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

@Component
public class StatusReporter {

  private static final Logger logger = LoggerFactory.getLogger(StatusReporter.class);

  private final RestClient statusCallbackRestClient;
  private final StatusCallbackProperties properties;
  private final DeliveryMetrics metrics;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient/DeliveryMetrics は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public StatusReporter(
      @Qualifier(RestClientConfig.STATUS_CALLBACK_REST_CLIENT) RestClient statusCallbackRestClient,
      StatusCallbackProperties properties,
      DeliveryMetrics metrics) {
    this.statusCallbackRestClient = statusCallbackRestClient;
    this.properties = properties;
    this.metrics = metrics;
  }

  /** 例外は送出しない。失敗はログとメトリクスにのみ残す。 */
  public void report(String requestId, NotificationStatus status, String error) {
    if (!properties.isActive()) {
      logger.debug("status callback disabled requestId={} status={}", requestId, status);
      return;
    }
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("notification_id", requestId);
    body.put("status", status.value());
    if (error != null) {
      body.put("error", error);
    }
    try {
      statusCallbackRestClient
          .post()
          .uri(properties.url())
          .contentType(MediaType.APPLICATION_JSON)
          .body(body)
          .retrieve()
          .toBodilessEntity();
      logger.debug("status callback sent requestId={} status={}", requestId, status);
    } catch (RuntimeException ex) {
      metrics.recordStatusReportFailure();
      logger.warn(
          "status callback failed requestId={} status={} error={}",
          requestId,
          status,
          ex.toString());
    }
  }
}
