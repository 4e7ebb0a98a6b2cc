/*
 * どこで: Notification 内部 API
 * 何を: ポータル本体から受け取る通知イベントの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.example.orchestrator.notification.api;

import com.example.orchestrator.notification.model.DispatchScope;
import com.example.orchestrator.notification.model.NotificationEventType;
import com.example.orchestrator.notification.model.NotificationPayload;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationEventRequest(
    @NotBlank(message = "event_type is required") String eventType,
    String title,
    String message,
    String url,
    String imageUrl,
    Map<String, String> fields,
    List<String> userIds,
    Boolean includeGlobal) {

  public NotificationEventType resolveEventType() {
    return NotificationEventType.fromKey(eventType)
        .orElseThrow(() -> new IllegalArgumentException("unknown event type: " + eventType));
  }

  public NotificationPayload toPayload() {
    return new NotificationPayload(resolveEventType(), title, message, url, imageUrl, fields);
  }

  /** user_ids が無ければ全体向け。include_global が true なら global エンドポイントも含める。 */
  public DispatchScope toScope() {
    if (userIds == null || userIds.isEmpty()) {
      return DispatchScope.all();
    }
    final Set<String> ids = new LinkedHashSet<>();
    for (String userId : userIds) {
      if (userId != null && !userId.isBlank()) {
        ids.add(userId);
      }
    }
    return includeGlobal != null && includeGlobal
        ? DispatchScope.usersAndGlobal(ids)
        : DispatchScope.users(ids);
  }
}
