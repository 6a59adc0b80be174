/*
 * どこで: Email 配信の設定バインド
 * 何を: JetStream MaxDeliver advisory の subject/stream/durable を保持する
 * なぜ: 再配信上限に達した配信要求を取りこぼさず恒久失敗として確定させるため
 */
package com.example.email.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "email.nats.advisory")
@Validated
public record EmailNatsAdvisoryProperties(
    @NotBlank String subject,
    @NotBlank String stream,
    @NotBlank String durable) {}
