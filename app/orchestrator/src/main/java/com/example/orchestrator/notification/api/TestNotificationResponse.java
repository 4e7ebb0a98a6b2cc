/*
 * どこで: Notification 管理 API
 * 何を: テスト送信の結果 (アダプタのエラーをそのまま含む)
 * なぜ: 管理者が設定不備の原因をその場で確認できるようにするため
 */
package com.example.orchestrator.notification.api;

import com.example.orchestrator.notification.model.DeliveryResult;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TestNotificationResponse(
    long endpointId, boolean ok, String errorKind, String errorMessage, Integer httpStatus) {

  public static TestNotificationResponse from(long endpointId, DeliveryResult result) {
    if (result.ok()) {
      return new TestNotificationResponse(endpointId, true, null, null, null);
    }
    return new TestNotificationResponse(
        endpointId,
        false,
        result.error().kind().name(),
        result.error().message(),
        result.error().httpStatus());
  }
}
