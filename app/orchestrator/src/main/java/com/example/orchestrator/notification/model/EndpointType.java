/*
 * どこで: Notification ドメインモデル
 * 何を: 通知エンドポイントのチャネル種別
 * なぜ: 種別ごとに設定スキーマと送信アダプタを一意に解決するため
 */
package com.example.orchestrator.notification.model;

import java.util.Locale;
import java.util.Optional;

public enum EndpointType {
  DISCORD("discord"),
  SLACK("slack"),
  WEBHOOK("webhook"),
  TELEGRAM("telegram"),
  PUSHOVER("pushover"),
  PUSHBULLET("pushbullet"),
  NTFY("ntfy"),
  GOTIFY("gotify"),
  EMAIL("email"),
  WEB_PUSH("webpush");

  private final String key;

  EndpointType(String key) {
    this.key = key;
  }

  public String key() {
    return key;
  }

  public static Optional<EndpointType> fromKey(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (EndpointType type : values()) {
      if (type.key.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
