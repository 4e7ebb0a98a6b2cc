/*
 * どこで: Notification チャネル層
 * 何を: Gotify サーバの /message へアプリトークンで通知する
 * なぜ: セルフホストのプッシュ基盤へ通知を届けるため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationPayload;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GotifyChannelAdapter implements NotificationChannelAdapter {

  private static final int DEFAULT_PRIORITY = 5;

  private final ChannelHttpClient httpClient;

  @Override
  public EndpointType type() {
    return EndpointType.GOTIFY;
  }

  @Override
  public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
    final String baseUrl = config.requireText("url");
    final String url = (baseUrl.endsWith("/") ? baseUrl : baseUrl + "/") + "message";
    final String token = config.requireText("token");
    return httpClient.postJson(
        url, buildBody(config, payload), headers -> headers.set("X-Gotify-Key", token));
  }

  Map<String, Object> buildBody(EndpointConfig config, NotificationPayload payload) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("title", payload.title());
    body.put("message", payload.message());
    body.put("priority", config.integer("priority", DEFAULT_PRIORITY));
    if (payload.url() != null) {
      body.put(
          "extras", Map.of("client::notification", Map.of("click", Map.of("url", payload.url()))));
    }
    return body;
  }
}
