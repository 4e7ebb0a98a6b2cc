/*
 * どこで: Notification チャネル層
 * 何を: ntfy サーバのトピックへ本文を POST する
 * なぜ: セルフホストの ntfy でも認証方式を選んで通知できるようにするため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationPayload;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class NtfyChannelAdapter implements NotificationChannelAdapter {

  private static final int DEFAULT_PRIORITY = 3;

  private final ChannelHttpClient httpClient;

  @Override
  public EndpointType type() {
    return EndpointType.NTFY;
  }

  @Override
  public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
    final String url =
        stripTrailingSlash(config.requireText("url")) + "/" + config.requireText("topic");
    return httpClient.postText(
        url, payload.message(), headers -> applyHeaders(headers, config, payload));
  }

  void applyHeaders(HttpHeaders headers, EndpointConfig config, NotificationPayload payload) {
    headers.set("Title", payload.title());
    headers.set("Priority", Integer.toString(config.integer("priority", DEFAULT_PRIORITY)));
    headers.set("Tags", payload.eventType().key());
    if (payload.url() != null) {
      headers.set("Click", payload.url());
    }
    final String authMethod = config.text("authMethod").orElse("none").toLowerCase(Locale.ROOT);
    switch (authMethod) {
      case "basic" -> headers.setBasicAuth(
          config.requireText("username"), config.requireText("password"));
      case "token" -> headers.setBearerAuth(config.requireText("token"));
      default -> {
        // 認証なし
      }
    }
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
