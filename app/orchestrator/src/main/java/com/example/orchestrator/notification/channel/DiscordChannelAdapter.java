/*
 * どこで: Notification チャネル層
 * 何を: Discord Webhook へ embed 形式で通知する
 * なぜ: イベント種別ごとの色やリンクをチャット上で判別しやすくするため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.config.NotificationDeliveryProperties;
import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationPayload;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DiscordChannelAdapter implements NotificationChannelAdapter {

  // Discord の description 上限
  private static final int MAX_DESCRIPTION_LENGTH = 4096;

  private final ChannelHttpClient httpClient;
  private final NotificationDeliveryProperties properties;
  private final Clock clock;

  @Override
  public EndpointType type() {
    return EndpointType.DISCORD;
  }

  @Override
  public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
    return httpClient.postJson(
        config.requireText("webhookUrl"), buildBody(config, payload), ChannelHttpClient.NO_HEADERS);
  }

  Map<String, Object> buildBody(EndpointConfig config, NotificationPayload payload) {
    final Map<String, Object> embed = new LinkedHashMap<>();
    embed.put("title", payload.title());
    embed.put("description", abbreviate(payload.message()));
    embed.put("color", payload.eventType().color());
    embed.put("timestamp", clock.instant().toString());
    embed.put("footer", Map.of("text", properties.appName()));
    if (payload.url() != null) {
      embed.put("url", payload.url());
    }
    if (payload.imageUrl() != null) {
      embed.put("thumbnail", Map.of("url", payload.imageUrl()));
    }
    if (!payload.fields().isEmpty()) {
      final List<Map<String, Object>> fields = new ArrayList<>();
      payload
          .fields()
          .forEach(
              (name, value) -> fields.add(Map.of("name", name, "value", value, "inline", true)));
      embed.put("fields", fields);
    }

    final Map<String, Object> body = new LinkedHashMap<>();
    config.text("botUsername").ifPresent(value -> body.put("username", value));
    config.text("botAvatarUrl").ifPresent(value -> body.put("avatar_url", value));
    final Optional<String> roleId = config.text("roleId");
    if (config.flag("enableMentions") && roleId.isPresent()) {
      body.put("content", "<@&" + roleId.get() + ">");
      body.put("allowed_mentions", Map.of("roles", List.of(roleId.get())));
    }
    body.put("embeds", List.of(embed));
    return body;
  }

  private String abbreviate(String message) {
    if (message.length() <= MAX_DESCRIPTION_LENGTH) {
      return message;
    }
    return message.substring(0, MAX_DESCRIPTION_LENGTH - 1) + "…";
  }
}
