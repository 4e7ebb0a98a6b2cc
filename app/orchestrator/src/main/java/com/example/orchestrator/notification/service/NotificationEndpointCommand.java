/*
 * どこで: Notification サービス層
 * 何を: エンドポイント作成/更新の入力値
 * なぜ: API の DTO と保存用レコードを分離するため
 */
package com.example.orchestrator.notification.service;

import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationTypeMask;

public record NotificationEndpointCommand(
    String name,
    EndpointType type,
    boolean enabled,
    boolean global,
    NotificationTypeMask eventMask,
    EndpointConfig config) {

  public NotificationEndpointCommand {
    eventMask = eventMask == null ? NotificationTypeMask.ALL : eventMask;
    config = config == null ? EndpointConfig.empty() : config;
  }
}
