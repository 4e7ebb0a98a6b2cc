/*
 * どこで: Notification 管理 API
 * 何を: エンドポイント一覧のレスポンス
 * なぜ: 将来のページング項目を足せるよう配列を直接返さないため
 */
package com.example.orchestrator.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationEndpointsResponse(List<NotificationEndpointResponse> endpoints) {

  public NotificationEndpointsResponse {
    endpoints = endpoints == null ? List.of() : List.copyOf(endpoints);
  }
}
