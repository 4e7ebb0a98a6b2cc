/*
 * どこで: Orchestrator 設定バインド
 * 何を: 通知送信の HTTP タイムアウト/並列度/表示名を保持する
 * なぜ: 外部チャネルの応答性に合わせて運用で調整するため
 */
package com.example.orchestrator.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.delivery")
public record NotificationDeliveryProperties(
    Duration httpConnectTimeout,
    Duration httpReadTimeout,
    Duration smtpTimeout,
    Duration sendTimeout,
    int dispatchThreads,
    String appName,
    int errorMessageMaxLength) {

  public NotificationDeliveryProperties {
    httpConnectTimeout = httpConnectTimeout == null ? Duration.ofSeconds(5) : httpConnectTimeout;
    httpReadTimeout = httpReadTimeout == null ? Duration.ofSeconds(10) : httpReadTimeout;
    smtpTimeout = smtpTimeout == null ? Duration.ofSeconds(15) : smtpTimeout;
    sendTimeout = sendTimeout == null ? Duration.ofSeconds(30) : sendTimeout;
    dispatchThreads = dispatchThreads <= 0 ? 8 : dispatchThreads;
    appName = appName == null || appName.isBlank() ? "Media Portal" : appName;
    errorMessageMaxLength = errorMessageMaxLength <= 0 ? 1000 : errorMessageMaxLength;
  }
}
