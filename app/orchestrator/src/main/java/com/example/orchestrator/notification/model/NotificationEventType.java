/*
 * どこで: Notification ドメインモデル
 * 何を: 通知イベント種別と eventMask 上の固定ビット位置を定義する
 * なぜ: 永続化済みマスクとの互換性を保つため、ビット番号を列挙順ではなく明示値で管理する
 */
package com.example.orchestrator.notification.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public enum NotificationEventType {
  // ビット 0 は NotificationTypeMask の「全カテゴリ」ワイルドカードとして予約済み
  REQUEST_PENDING(1, "request_pending", "Request Pending Approval", Colors.ORANGE),
  REQUEST_SUBMITTED(2, "request_submitted", "Request Approved", Colors.PURPLE),
  REQUEST_AVAILABLE(3, "request_available", "Now Available", Colors.GREEN),
  REQUEST_FAILED(4, "request_failed", "Request Failed", Colors.RED),
  TEST_NOTIFICATION(5, "test_notification", "Test Notification", Colors.BLUE),
  REQUEST_DENIED(6, "request_denied", "Request Declined", Colors.RED),
  REQUEST_PARTIALLY_AVAILABLE(
      7, "request_partially_available", "Partially Available", Colors.GREEN),
  ISSUE_REPORTED(8, "issue_reported", "Issue Reported", Colors.RED),
  ISSUE_RESOLVED(9, "issue_resolved", "Issue Resolved", Colors.GREEN),
  REQUEST_DOWNLOADING(10, "request_downloading", "Downloading", Colors.PURPLE),
  SYSTEM_ALERT_HIGH_LATENCY(11, "system_alert_high_latency", "High Latency", Colors.ORANGE),
  SYSTEM_ALERT_SERVICE_UNREACHABLE(
      12, "system_alert_service_unreachable", "Service Unreachable", Colors.RED),
  SYSTEM_ALERT_INDEXERS_UNAVAILABLE(
      13, "system_alert_indexers_unavailable", "Indexers Unavailable", Colors.RED),
  JOB_FAILED(14, "job_failed", "Job Failed", Colors.RED),
  WEEKLY_DIGEST(15, "weekly_digest", "Weekly Digest", Colors.GREY);

  // 旧イベント名は既存カテゴリへ寄せる
  private static final Map<String, NotificationEventType> LEGACY_ALIASES =
      Map.of(
          "request_already_exists", REQUEST_PENDING,
          "request_removed", REQUEST_FAILED,
          "media_available", REQUEST_AVAILABLE,
          "request_approved", REQUEST_SUBMITTED,
          "request_declined", REQUEST_DENIED);

  private final int bit;
  private final String key;
  private final String label;
  private final int color;

  NotificationEventType(int bit, String key, String label, int color) {
    this.bit = bit;
    this.key = key;
    this.label = label;
    this.color = color;
  }

  public int bit() {
    return bit;
  }

  public int mask() {
    return 1 << bit;
  }

  public String key() {
    return key;
  }

  public String label() {
    return label;
  }

  /** Discord embed などで使う RGB 値。 */
  public int color() {
    return color;
  }

  public static Optional<NotificationEventType> fromKey(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (NotificationEventType type : values()) {
      if (type.key.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.ofNullable(LEGACY_ALIASES.get(normalized));
  }

  private static final class Colors {
    static final int ORANGE = 15105570;
    static final int PURPLE = 10181046;
    static final int GREEN = 3066993;
    static final int RED = 15158332;
    static final int GREY = 9807270;
    static final int BLUE = 3447003;

    private Colors() {}
  }
}
