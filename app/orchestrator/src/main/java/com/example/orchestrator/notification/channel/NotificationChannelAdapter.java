/*
 * どこで: Notification チャネル層
 * 何を: 1 種類の外部チャネルへ通知を 1 件送る契約
 * なぜ: ディスパッチャがチャネルの違いを意識せずにファンアウトできるようにするため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationPayload;

/**
 * チャネル別の送信アダプタ。
 *
 * <p>配信失敗は例外ではなく {@link DeliveryResult} で返す。実装は呼び出し間で可変状態を共有しない。
 */
public interface NotificationChannelAdapter {

  EndpointType type();

  DeliveryResult send(EndpointConfig config, NotificationPayload payload);
}
