/*
 * どこで: Notification 管理 API
 * 何を: エンドポイント 1 件のレスポンス (秘密値はマスク済み)
 * なぜ: 管理画面へ Webhook URL やトークンを平文で返さないため
 */
package com.example.orchestrator.notification.api;

import com.example.orchestrator.notification.model.NotificationEndpointRecord;
import com.example.orchestrator.notification.model.NotificationEventType;
import com.example.orchestrator.notification.service.EndpointConfigSchema;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationEndpointResponse(
    long id,
    String name,
    String type,
    boolean enabled,
    boolean global,
    int eventMask,
    boolean allEventTypes,
    List<String> eventTypes,
    Map<String, Object> config,
    Instant createdAt,
    Instant updatedAt) {

  public NotificationEndpointResponse {
    eventTypes = eventTypes == null ? List.of() : List.copyOf(eventTypes);
    config =
        config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
  }

  public static NotificationEndpointResponse from(NotificationEndpointRecord record) {
    return new NotificationEndpointResponse(
        record.id(),
        record.name(),
        record.type().key(),
        record.enabled(),
        record.global(),
        record.eventMask().value(),
        record.eventMask().allCategories(),
        record.eventMask().selectedTypes().stream().map(NotificationEventType::key).toList(),
        record.config().masked(EndpointConfigSchema.secretKeys(record.type())).values(),
        record.createdAt(),
        record.updatedAt());
  }
}
