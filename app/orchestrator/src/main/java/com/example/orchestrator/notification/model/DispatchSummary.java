/*
 * どこで: Notification ドメインモデル
 * 何を: 1 イベントのファンアウト結果
 * なぜ: 部分失敗を例外にせず件数で呼び出し側へ伝えるため
 */
package com.example.orchestrator.notification.model;

import java.util.List;

public record DispatchSummary(
    NotificationEventType eventType,
    int matched,
    int delivered,
    int failed,
    List<DeliveryAttempt> attempts) {

  public DispatchSummary {
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
  }

  public static DispatchSummary of(
      NotificationEventType eventType, List<DeliveryAttempt> attempts) {
    int delivered = 0;
    for (DeliveryAttempt attempt : attempts) {
      if (attempt.ok()) {
        delivered++;
      }
    }
    return new DispatchSummary(
        eventType, attempts.size(), delivered, attempts.size() - delivered, attempts);
  }

  public static DispatchSummary empty(NotificationEventType eventType) {
    return new DispatchSummary(eventType, 0, 0, 0, List.of());
  }
}
