/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: サーキットブレーカーや lease 計算の時刻をテストで固定できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
