/*
 * どこで: Notification ドメインモデル
 * 何を: 1 回の送信失敗の分類と詳細
 * なぜ: 呼び出し側が例外ではなく値で失敗理由を判別できるようにするため
 */
package com.example.orchestrator.notification.model;

public record DeliveryError(Kind kind, String message, Integer httpStatus) {

  public enum Kind {
    HTTP_STATUS,
    NETWORK,
    TIMEOUT,
    SUBSCRIPTION_GONE,
    INVALID_CONFIG,
    INTERNAL
  }

  public DeliveryError {
    if (kind == null) {
      throw new IllegalArgumentException("kind is required");
    }
    message = message == null ? "" : message;
  }

  public static DeliveryError of(Kind kind, String message) {
    return new DeliveryError(kind, message, null);
  }

  public static DeliveryError httpStatus(int status, String body) {
    return new DeliveryError(Kind.HTTP_STATUS, "HTTP " + status + ": " + body, status);
  }
}
