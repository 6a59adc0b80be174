/*
 * どこで: Email 配信サービス層
 * 何を: テンプレートサービスから template_code に対応する本文テンプレートを取得する
 * なぜ: HTTP の失敗を理由付きの例外へ変換し、呼び出し側がフォールバックを判断できるようにするため
 */
package com.example.email.service;

import com.example.email.config.RestClientConfig;
import com.example.email.config.TemplateClientProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

@Service
public class TemplateClient {

  private static final Logger logger = LoggerFactory.getLogger(TemplateClient.class);

  private final RestClient templateRestClient;
  private final TemplateClientProperties properties;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public TemplateClient(
      @Qualifier(RestClientConfig.TEMPLATE_REST_CLIENT) RestClient templateRestClient,
      TemplateClientProperties properties) {
    this.templateRestClient = templateRestClient;
    this.properties = properties;
  }

  public String fetchTemplate(String templateCode) {
    if (templateCode == null || templateCode.isBlank()) {
      throw new IllegalArgumentException("templateCode is required");
    }
    try {
      final TemplateResponse response =
          templateRestClient
              .get()
              .uri(properties.templatePath(), templateCode)
              .retrieve()
              .body(TemplateResponse.class);
      if (response == null || response.templateContent() == null || response.templateContent().isBlank()) {
        throw new TemplateIntegrationException(
            TemplateIntegrationException.Reason.INVALID_RESPONSE,
            "template response has no template_content templateCode=" + templateCode);
      }
      return response.templateContent();
    } catch (RestClientResponseException ex) {
      throw mapResponseException(templateCode, ex);
    } catch (ResourceAccessException ex) {
      throw mapResourceException(templateCode, ex);
    } catch (TemplateIntegrationException ex) {
      throw ex;
    } catch (RuntimeException ex) {
      logger.warn("template response parse failed templateCode={}", templateCode, ex);
      throw new TemplateIntegrationException(
          TemplateIntegrationException.Reason.INVALID_RESPONSE, "template response parse failed", ex);
    }
  }

  private TemplateIntegrationException mapResponseException(
      String templateCode, RestClientResponseException ex) {
    logger.warn(
        "template fetch failed templateCode={} status={}",
        templateCode,
        ex.getStatusCode().value());
    if (ex.getStatusCode().value() == 404) {
      return new TemplateIntegrationException(
          TemplateIntegrationException.Reason.NOT_FOUND, "template not found: " + templateCode, ex);
    }
    return new TemplateIntegrationException(
        TemplateIntegrationException.Reason.BAD_GATEWAY,
        "template service returned " + ex.getStatusCode().value(),
        ex);
  }

  private TemplateIntegrationException mapResourceException(
      String templateCode, ResourceAccessException ex) {
    if (isTimeout(ex)) {
      logger.warn("template fetch timed out templateCode={}", templateCode);
      return new TemplateIntegrationException(
          TemplateIntegrationException.Reason.TIMEOUT, "template request timeout", ex);
    }
    logger.warn("template fetch connection failed templateCode={}", templateCode, ex);
    return new TemplateIntegrationException(
        TemplateIntegrationException.Reason.BAD_GATEWAY, "template connection failed", ex);
  }

  private boolean isTimeout(ResourceAccessException ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }

  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public record TemplateResponse(String templateContent) {}
}
