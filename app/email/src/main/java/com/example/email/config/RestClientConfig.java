/*
 * どこで: Email 配信のインフラ設定
 * 何を: テンプレート取得用と状態通知用の RestClient を提供する
 * なぜ: 下流サービスごとに baseUrl とタイムアウトの設定責務を分離するため
 */
package com.example.email.config;

import java.time.Duration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties({TemplateClientProperties.class, StatusCallbackProperties.class})
public class RestClientConfig {

  public static final String TEMPLATE_REST_CLIENT = "templateRestClient";
  public static final String STATUS_CALLBACK_REST_CLIENT = "statusCallbackRestClient";

  @Bean(TEMPLATE_REST_CLIENT)
  RestClient templateRestClient(RestClient.Builder builder, TemplateClientProperties properties) {
    return builder
        .baseUrl(properties.baseUrl())
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  @Bean(STATUS_CALLBACK_REST_CLIENT)
  RestClient statusCallbackRestClient(
      RestClient.Builder builder, StatusCallbackProperties properties) {
    // URL はコールバックごとに完全指定するため baseUrl は持たない
    return builder
        .requestFactory(requestFactory(properties.connectTimeout(), properties.readTimeout()))
        .build();
  }

  private SimpleClientHttpRequestFactory requestFactory(
      Duration connectTimeout, Duration readTimeout) {
    final SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
    factory.setConnectTimeout(connectTimeout);
    factory.setReadTimeout(readTimeout);
    return factory;
  }
}
