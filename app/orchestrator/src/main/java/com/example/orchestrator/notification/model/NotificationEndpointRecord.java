/*
 * どこで: Notification ドメインモデル
 * 何を: notification_endpoints テーブルの 1 行
 * なぜ: リポジトリとサービス間で型付きで受け渡すため
 */
package com.example.orchestrator.notification.model;

import java.time.Instant;

public record NotificationEndpointRecord(
    Long id,
    String name,
    EndpointType type,
    boolean enabled,
    boolean global,
    NotificationTypeMask eventMask,
    EndpointConfig config,
    Instant createdAt,
    Instant updatedAt) {

  public boolean accepts(NotificationEventType eventType) {
    return enabled && eventMask.includes(eventType);
  }

  public NotificationEndpointRecord withConfig(EndpointConfig newConfig) {
    return new NotificationEndpointRecord(
        id, name, type, enabled, global, eventMask, newConfig, createdAt, updatedAt);
  }
}
