/*
 * どこで: Email 配信サービス層
 * 何を: JavaMailSender で SMTP 送信する
 * なぜ: 本番環境で実際にメールを届けるため
 */
package com.example.email.service;

import com.example.email.config.SmtpProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "email.smtp", name = "enabled", havingValue = "true")
public class SmtpMailTransport implements MailTransport {

  private static final Logger logger = LoggerFactory.getLogger(SmtpMailTransport.class);

  private final JavaMailSender mailSender;
  private final SmtpProperties properties;

  @Override
  public void send(MailMessage message) {
    try {
      final MimeMessage mimeMessage = mailSender.createMimeMessage();
      final MimeMessageHelper helper = new MimeMessageHelper(mimeMessage, "UTF-8");
      helper.setFrom(properties.from());
      helper.setTo(message.to());
      helper.setSubject(message.subject());
      helper.setText(message.body(), message.html());
      // タイムアウトは spring.mail.properties の mail.smtp.*timeout で打ち切る
      mailSender.send(mimeMessage);
      logger.info("smtp mail sent to={} html={}", message.to(), message.html());
    } catch (MessagingException | MailException ex) {
      throw new MailTransportException("smtp send failed to=" + message.to(), ex);
    }
  }
}
