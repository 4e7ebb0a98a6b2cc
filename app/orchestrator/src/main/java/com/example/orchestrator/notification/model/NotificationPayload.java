/*
 * どこで: Notification ドメインモデル
 * 何を: チャネル非依存の通知本文
 * なぜ: 各アダプタが同じ入力から自チャネルの形式を組み立てるため
 */
package com.example.orchestrator.notification.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record NotificationPayload(
    NotificationEventType eventType,
    String title,
    String message,
    String url,
    String imageUrl,
    Map<String, String> fields) {

  public NotificationPayload {
    if (eventType == null) {
      throw new IllegalArgumentException("eventType is required");
    }
    if (title == null || title.isBlank()) {
      title = eventType.label();
    }
    message = message == null ? "" : message;
    fields =
        fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
  }

  public static NotificationPayload of(
      NotificationEventType eventType, String title, String message) {
    return new NotificationPayload(eventType, title, message, null, null, Map.of());
  }

  public NotificationPayload withUrl(String url) {
    return new NotificationPayload(eventType, title, message, url, imageUrl, fields);
  }

  public NotificationPayload withField(String name, String value) {
    final Map<String, String> next = new LinkedHashMap<>(fields);
    next.put(name, value);
    return new NotificationPayload(eventType, title, message, url, imageUrl, next);
  }
}
