/*
 * どこで: Notification 内部 API
 * 何を: イベント受付結果のレスポンス
 * なぜ: 非同期配信のため受付時点の解釈 (種別/範囲) だけを返すため
 */
package com.example.orchestrator.notification.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationEventAcceptedResponse(String eventType, String scope) {}
