/*
 * どこで: Notification チャネル層
 * 何を: Pushbullet へ note push を送る
 * なぜ: 個人端末またはチャンネル購読者へ通知を届けるため
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
public class PushbulletChannelAdapter implements NotificationChannelAdapter {

  static final String API_URL = "https://api.pushbullet.com/v2/pushes";

  private final ChannelHttpClient httpClient;

  @Override
  public EndpointType type() {
    return EndpointType.PUSHBULLET;
  }

  @Override
  public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
    final String accessToken = config.requireText("accessToken");
    return httpClient.postJson(
        API_URL, buildBody(config, payload), headers -> headers.set("Access-Token", accessToken));
  }

  Map<String, Object> buildBody(EndpointConfig config, NotificationPayload payload) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("type", "note");
    body.put("title", payload.title());
    body.put("body", payload.message());
    config.text("channelTag").ifPresent(value -> body.put("channel_tag", value));
    return body;
  }
}
