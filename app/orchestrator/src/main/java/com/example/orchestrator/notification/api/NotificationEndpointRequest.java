/*
 * どこで: Notification 管理 API
 * 何を: エンドポイント作成/更新リクエストの入力を保持する
 * なぜ: JSON からのバインドと検証を明確にするため
 */
package com.example.orchestrator.notification.api;

import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationEventType;
import com.example.orchestrator.notification.model.NotificationTypeMask;
import com.example.orchestrator.notification.service.NotificationEndpointCommand;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationEndpointRequest(
    @NotBlank(message = "name is required") String name,
    @NotBlank(message = "type is required") String type,
    Boolean enabled,
    Boolean global,
    Integer eventMask,
    List<String> eventTypes,
    Map<String, Object> config) {

  /** event_types が指定されていれば event_mask より優先する。どちらも無ければ全カテゴリ。 */
  public NotificationEndpointCommand toCommand() {
    final EndpointType endpointType =
        EndpointType.fromKey(type)
            .orElseThrow(() -> new IllegalArgumentException("unknown endpoint type: " + type));
    return new NotificationEndpointCommand(
        name,
        endpointType,
        enabled == null || enabled,
        global != null && global,
        resolveMask(),
        new EndpointConfig(config));
  }

  private NotificationTypeMask resolveMask() {
    if (eventTypes != null && !eventTypes.isEmpty()) {
      NotificationTypeMask mask = NotificationTypeMask.NONE;
      for (String key : eventTypes) {
        if ("all".equalsIgnoreCase(key)) {
          mask = new NotificationTypeMask(mask.value() | NotificationTypeMask.ALL.value());
          continue;
        }
        mask =
            mask.with(
                NotificationEventType.fromKey(key)
                    .orElseThrow(() -> new IllegalArgumentException("unknown event type: " + key)));
      }
      return mask;
    }
    return NotificationTypeMask.ofValue(eventMask);
  }
}
