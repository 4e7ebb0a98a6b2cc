/*
 * どこで: Notification チャネル層
 * 何を: Telegram Bot API の sendMessage で通知する
 * なぜ: チャット/スレッド宛に HTML 整形済みの通知を届けるため
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
import org.springframework.web.util.HtmlUtils;

@Component
@RequiredArgsConstructor
public class TelegramChannelAdapter implements NotificationChannelAdapter {

  static final String API_BASE_URL = "https://api.telegram.org";

  private final ChannelHttpClient httpClient;

  @Override
  public EndpointType type() {
    return EndpointType.TELEGRAM;
  }

  @Override
  public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
    final String url = API_BASE_URL + "/bot" + config.requireText("botToken") + "/sendMessage";
    return httpClient.postJson(url, buildBody(config, payload), ChannelHttpClient.NO_HEADERS);
  }

  Map<String, Object> buildBody(EndpointConfig config, NotificationPayload payload) {
    final StringBuilder text = new StringBuilder();
    text.append("<b>").append(HtmlUtils.htmlEscape(payload.title())).append("</b>");
    if (!payload.message().isBlank()) {
      text.append('\n').append(HtmlUtils.htmlEscape(payload.message()));
    }
    payload
        .fields()
        .forEach(
            (name, value) ->
                text.append("\n<b>")
                    .append(HtmlUtils.htmlEscape(name))
                    .append(":</b> ")
                    .append(HtmlUtils.htmlEscape(value)));
    if (payload.url() != null) {
      text.append("\n<a href=\"")
          .append(HtmlUtils.htmlEscape(payload.url()))
          .append("\">Open</a>");
    }

    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("chat_id", config.requireText("chatId"));
    body.put("text", text.toString());
    body.put("parse_mode", "HTML");
    body.put("disable_notification", config.flag("sendSilently"));
    config.integer("messageThreadId").ifPresent(value -> body.put("message_thread_id", value));
    return body;
  }
}
