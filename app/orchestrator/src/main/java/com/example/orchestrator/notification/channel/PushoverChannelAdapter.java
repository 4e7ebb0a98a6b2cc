/*
 * どこで: Notification チャネル層
 * 何を: Pushover Messages API へフォーム POST で通知する
 * なぜ: 端末プッシュの優先度/通知音を設定どおりに指定するため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

@Component
@RequiredArgsConstructor
public class PushoverChannelAdapter implements NotificationChannelAdapter {

  static final String API_URL = "https://api.pushover.net/1/messages.json";

  // priority=2 (緊急) は再送間隔と期限の指定が必須
  private static final int EMERGENCY_PRIORITY = 2;
  private static final String EMERGENCY_RETRY_SECONDS = "60";
  private static final String EMERGENCY_EXPIRE_SECONDS = "3600";

  private final ChannelHttpClient httpClient;

  @Override
  public EndpointType type() {
    return EndpointType.PUSHOVER;
  }

  @Override
  public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
    return httpClient.postForm(API_URL, buildForm(config, payload), ChannelHttpClient.NO_HEADERS);
  }

  MultiValueMap<String, String> buildForm(EndpointConfig config, NotificationPayload payload) {
    final MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("token", config.requireText("apiToken"));
    form.add("user", config.requireText("userKey"));
    form.add("title", payload.title());
    form.add("message", payload.message().isBlank() ? payload.title() : payload.message());
    final int priority = config.integer("priority", 0);
    form.add("priority", Integer.toString(priority));
    if (priority == EMERGENCY_PRIORITY) {
      form.add("retry", EMERGENCY_RETRY_SECONDS);
      form.add("expire", EMERGENCY_EXPIRE_SECONDS);
    }
    config.text("sound").ifPresent(value -> form.add("sound", value));
    if (payload.url() != null) {
      form.add("url", payload.url());
    }
    return form;
  }
}
