/*
 * どこで: Notification チャネル層
 * 何を: エンドポイント設定から送信ごとの JavaMailSender を組み立てる
 * なぜ: SMTP 接続情報がエンドポイント単位で異なり、共有の送信器を持てないため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.config.NotificationDeliveryProperties;
import com.example.orchestrator.notification.model.EndpointConfig;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import lombok.RequiredArgsConstructor;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class MailSenderFactory {

  private static final int PLAIN_PORT = 25;
  private static final int STARTTLS_PORT = 587;
  private static final int TLS_PORT = 465;

  private final NotificationDeliveryProperties properties;

  public JavaMailSender create(EndpointConfig config) {
    final JavaMailSenderImpl sender = new JavaMailSenderImpl();
    final String encryption = config.text("encryption").orElse("none").toLowerCase(Locale.ROOT);
    sender.setHost(config.requireText("smtpHost"));
    sender.setPort(config.integer("smtpPort", defaultPort(encryption)));
    sender.setDefaultEncoding(StandardCharsets.UTF_8.name());

    final Properties mailProperties = sender.getJavaMailProperties();
    final String timeoutMillis = Long.toString(properties.smtpTimeout().toMillis());
    mailProperties.put("mail.smtp.connectiontimeout", timeoutMillis);
    mailProperties.put("mail.smtp.timeout", timeoutMillis);
    mailProperties.put("mail.smtp.writetimeout", timeoutMillis);

    final Optional<String> authUser = config.text("authUser");
    mailProperties.put("mail.smtp.auth", Boolean.toString(authUser.isPresent()));
    authUser.ifPresent(
        user -> {
          sender.setUsername(user);
          sender.setPassword(config.text("authPass").orElse(""));
        });

    switch (encryption) {
      case "starttls" -> {
        mailProperties.put("mail.smtp.starttls.enable", "true");
        mailProperties.put("mail.smtp.starttls.required", "true");
      }
      case "tls" -> mailProperties.put("mail.smtp.ssl.enable", "true");
      default -> {
        // 平文 SMTP
      }
    }
    if (config.flag("allowSelfSigned")) {
      mailProperties.put("mail.smtp.ssl.trust", "*");
    }
    return sender;
  }

  private static int defaultPort(String encryption) {
    return switch (encryption) {
      case "starttls" -> STARTTLS_PORT;
      case "tls" -> TLS_PORT;
      default -> PLAIN_PORT;
    };
  }
}
