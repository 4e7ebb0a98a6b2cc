/*
 * どこで: Notification チャネル層
 * 何を: Slack Incoming Webhook へ Block Kit 形式で通知する
 * なぜ: 見出し/本文/リンクを Slack 上で構造化表示するため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationPayload;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class SlackChannelAdapter implements NotificationChannelAdapter {

  private final ChannelHttpClient httpClient;

  @Override
  public EndpointType type() {
    return EndpointType.SLACK;
  }

  @Override
  public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
    return httpClient.postJson(
        config.requireText("webhookUrl"), buildBody(config, payload), ChannelHttpClient.NO_HEADERS);
  }

  Map<String, Object> buildBody(EndpointConfig config, NotificationPayload payload) {
    final List<Map<String, Object>> blocks = new ArrayList<>();
    blocks.add(Map.of("type", "header", "text", plainText(payload.title())));
    if (!payload.message().isBlank()) {
      blocks.add(Map.of("type", "section", "text", markdown(payload.message())));
    }
    if (!payload.fields().isEmpty()) {
      final List<Map<String, Object>> fields = new ArrayList<>();
      payload
          .fields()
          .forEach((name, value) -> fields.add(markdown("*" + name + "*\n" + value)));
      blocks.add(Map.of("type", "section", "fields", fields));
    }
    if (payload.url() != null) {
      blocks.add(
          Map.of(
              "type",
              "actions",
              "elements",
              List.of(
                  Map.of(
                      "type", "button", "text", plainText("Open"), "url", payload.url()))));
    }

    final Map<String, Object> body = new LinkedHashMap<>();
    // blocks 非対応クライアント向けのフォールバック本文
    body.put("text", payload.title() + ": " + payload.message());
    body.put("blocks", blocks);
    config.text("botUsername").ifPresent(value -> body.put("username", value));
    config.text("botEmoji").ifPresent(value -> body.put("icon_emoji", value));
    return body;
  }

  private static Map<String, Object> plainText(String text) {
    return Map.of("type", "plain_text", "text", text);
  }

  private static Map<String, Object> markdown(String text) {
    return Map.of("type", "mrkdwn", "text", text);
  }
}
