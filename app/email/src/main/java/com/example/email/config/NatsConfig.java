/*
 * どこで: Email 配信のインフラ設定
 * 何を: NATS Connection と配信要求を処理するスレッドプールを Spring 管理下に置く
 * なぜ: キュー発行/購読と dead-letter 発行が同一接続を再利用し、配信を dispatcher スレッドの外で並列に進めるため
 */
package com.example.email.config;

import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class NatsConfig {

  public static final String DELIVERY_EXECUTOR = "emailDeliveryExecutor";

  @Bean(destroyMethod = "close")
  public Connection natsConnection(NatsProperties properties)
      throws IOException, InterruptedException {
    final Options options =
        new Options.Builder()
            .server(properties.url())
            .connectionName("email-service")
            .connectionTimeout(Duration.ofSeconds(properties.connectionTimeout()))
            .build();
    return Nats.connect(options);
  }

  /**
   * 配信要求の処理スレッド。consumer の max-ack-pending を同じ並列数に揃えるため、通常はキューに積まれない。
   * 飽和時は dispatcher スレッドで実行して受信を抑える。
   */
  @Bean(DELIVERY_EXECUTOR)
  public ThreadPoolTaskExecutor emailDeliveryExecutor(EmailNatsProperties properties) {
    final ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.concurrency());
    executor.setMaxPoolSize(properties.concurrency());
    executor.setQueueCapacity(properties.concurrency());
    executor.setThreadNamePrefix("email-delivery-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    // 停止時は処理中の配信を終えてから ack/nak させる
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    return executor;
  }
}
