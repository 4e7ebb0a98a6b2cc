/*
 * どこで: Notification ドメインモデル
 * 何を: dispatch 中の 1 エンドポイント分の送信記録
 * なぜ: 永続化せずに DispatchSummary へ結果を返すため
 */
package com.example.orchestrator.notification.model;

public record DeliveryAttempt(
    long endpointId, EndpointType endpointType, boolean ok, DeliveryError error, long durationMs) {

  public static DeliveryAttempt from(
      NotificationEndpointRecord endpoint, DeliveryResult result, long durationMs) {
    return new DeliveryAttempt(
        endpoint.id(), endpoint.type(), result.ok(), result.error(), durationMs);
  }
}
