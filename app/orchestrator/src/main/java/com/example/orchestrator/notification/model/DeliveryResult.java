/*
 * どこで: Notification ドメインモデル
 * 何を: アダプタ送信結果 (成功 or DeliveryError)
 * なぜ: 配信失敗を throw せずに集計へ流すため
 */
package com.example.orchestrator.notification.model;

public record DeliveryResult(boolean ok, DeliveryError error) {

  private static final DeliveryResult SUCCESS = new DeliveryResult(true, null);

  public DeliveryResult {
    if (ok && error != null) {
      throw new IllegalArgumentException("successful result must not carry an error");
    }
    if (!ok && error == null) {
      throw new IllegalArgumentException("failed result requires an error");
    }
  }

  public static DeliveryResult success() {
    return SUCCESS;
  }

  public static DeliveryResult failure(DeliveryError error) {
    return new DeliveryResult(false, error);
  }

  public static DeliveryResult failure(DeliveryError.Kind kind, String message) {
    return failure(DeliveryError.of(kind, message));
  }

  public boolean subscriptionGone() {
    return !ok && error.kind() == DeliveryError.Kind.SUBSCRIPTION_GONE;
  }
}
