/*
 * どこで: Notification サービス層
 * 何を: 指定 ID のエンドポイントが存在しないことを表す
 * なぜ: API 層で 404 へ一貫変換するため
 */
package com.example.orchestrator.notification.service;

public class NotificationEndpointNotFoundException extends RuntimeException {

  public NotificationEndpointNotFoundException(long endpointId) {
    super("notification endpoint not found: " + endpointId);
  }
}
