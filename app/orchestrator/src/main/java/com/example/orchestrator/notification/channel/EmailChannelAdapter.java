/*
 * どこで: Notification チャネル層
 * 何を: SMTP でテキスト/HTML のマルチパートメールを送る
 * なぜ: メールアドレス宛の通知チャネルを提供するため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.config.NotificationDeliveryProperties;
import com.example.orchestrator.notification.model.DeliveryError;
import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationPayload;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.mail.MailAuthenticationException;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

@Component
@RequiredArgsConstructor
public class EmailChannelAdapter implements NotificationChannelAdapter {

  private static final Logger logger = LoggerFactory.getLogger(EmailChannelAdapter.class);

  private final MailSenderFactory mailSenderFactory;
  private final NotificationDeliveryProperties properties;

  @Override
  public EndpointType type() {
    return EndpointType.EMAIL;
  }

  @Override
  public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
    final JavaMailSender sender = mailSenderFactory.create(config);
    try {
      final MimeMessage message = sender.createMimeMessage();
      final MimeMessageHelper helper =
          new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
      helper.setFrom(
          config.requireText("senderAddress"),
          config.text("senderName").orElse(properties.appName()));
      helper.setTo(config.requireText("recipient"));
      helper.setSubject("[" + properties.appName() + "] " + payload.title());
      helper.setText(plainBody(payload), htmlBody(payload));
      sender.send(message);
      return DeliveryResult.success();
    } catch (MailAuthenticationException ex) {
      logger.warn("smtp authentication failed host={}", config.text("smtpHost").orElse(""));
      return DeliveryResult.failure(DeliveryError.Kind.NETWORK, "smtp authentication failed");
    } catch (MailException ex) {
      if (ChannelHttpClient.isTimeout(ex)) {
        return DeliveryResult.failure(DeliveryError.Kind.TIMEOUT, "smtp request timed out");
      }
      logger.warn("smtp send failed host={}", config.text("smtpHost").orElse(""), ex);
      return DeliveryResult.failure(DeliveryError.Kind.NETWORK, String.valueOf(ex.getMessage()));
    } catch (MessagingException | UnsupportedEncodingException ex) {
      return DeliveryResult.failure(
          DeliveryError.Kind.INVALID_CONFIG, "mail message could not be built: " + ex.getMessage());
    }
  }

  String plainBody(NotificationPayload payload) {
    final StringBuilder body = new StringBuilder(payload.title()).append("\n\n");
    body.append(payload.message()).append('\n');
    payload
        .fields()
        .forEach((name, value) -> body.append('\n').append(name).append(": ").append(value));
    if (payload.url() != null) {
      body.append("\n\n").append(payload.url());
    }
    return body.toString();
  }

  String htmlBody(NotificationPayload payload) {
    final StringBuilder body = new StringBuilder("<html><body>");
    body.append("<h2>").append(HtmlUtils.htmlEscape(payload.title())).append("</h2>");
    body.append("<p>").append(HtmlUtils.htmlEscape(payload.message())).append("</p>");
    if (!payload.fields().isEmpty()) {
      body.append("<ul>");
      payload
          .fields()
          .forEach(
              (name, value) ->
                  body.append("<li><b>")
                      .append(HtmlUtils.htmlEscape(name))
                      .append(":</b> ")
                      .append(HtmlUtils.htmlEscape(value))
                      .append("</li>"));
      body.append("</ul>");
    }
    if (payload.imageUrl() != null) {
      body.append("<img src=\"")
          .append(HtmlUtils.htmlEscape(payload.imageUrl()))
          .append("\" alt=\"\">");
    }
    if (payload.url() != null) {
      body.append("<p><a href=\"")
          .append(HtmlUtils.htmlEscape(payload.url()))
          .append("\">Open</a></p>");
    }
    return body.append("</body></html>").toString();
  }
}
