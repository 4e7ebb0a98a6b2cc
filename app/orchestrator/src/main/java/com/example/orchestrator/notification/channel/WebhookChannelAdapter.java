/*
 * どこで: Notification チャネル層
 * 何を: 任意 URL へユーザー定義の JSON テンプレートを展開して POST する
 * なぜ: 専用アダプタのない外部システムとも連携できるようにするため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationPayload;
import com.fasterxml.jackson.core.io.JsonStringEncoder;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class WebhookChannelAdapter implements NotificationChannelAdapter {

  static final String DEFAULT_TEMPLATE =
      """
      {"notification_type":"{{event}}","subject":"{{title}}","message":"{{message}}",\
      "url":"{{url}}","image":"{{image}}"}""";

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(\\w+)\\s*}}");

  private final ChannelHttpClient httpClient;

  @Override
  public EndpointType type() {
    return EndpointType.WEBHOOK;
  }

  @Override
  public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
    final String body = render(config.text("jsonPayload").orElse(DEFAULT_TEMPLATE), payload);
    return httpClient.postJson(
        config.requireText("webhookUrl"),
        body,
        headers ->
            config
                .text("authHeader")
                .ifPresent(value -> headers.set(HttpHeaders.AUTHORIZATION, value)));
  }

  /** {{name}} を JSON 文字列としてエスケープした値で置換する。未知の名前は空文字にする。 */
  static String render(String template, NotificationPayload payload) {
    final Map<String, String> values =
        Map.of(
            "event", payload.eventType().key(),
            "title", payload.title(),
            "message", payload.message(),
            "url", nullToEmpty(payload.url()),
            "image", nullToEmpty(payload.imageUrl()));
    final Matcher matcher = PLACEHOLDER.matcher(template);
    final StringBuilder rendered = new StringBuilder();
    while (matcher.find()) {
      final String value = values.getOrDefault(matcher.group(1), "");
      final String escaped = new String(JsonStringEncoder.getInstance().quoteAsString(value));
      matcher.appendReplacement(rendered, Matcher.quoteReplacement(escaped));
    }
    matcher.appendTail(rendered);
    return rendered.toString();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
