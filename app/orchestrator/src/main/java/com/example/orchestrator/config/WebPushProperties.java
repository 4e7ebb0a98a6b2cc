/*
 * どこで: Orchestrator 設定バインド
 * 何を: Web Push の VAPID 鍵と subject を保持する
 * なぜ: 鍵を DB ではなく環境変数から注入するため
 */
package com.example.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "notification.web-push")
public record WebPushProperties(String publicKey, String privateKey, String subject) {

  public WebPushProperties {
    subject = subject == null || subject.isBlank() ? "mailto:admin@localhost" : subject;
  }

  public boolean configured() {
    return publicKey != null && !publicKey.isBlank() && privateKey != null && !privateKey.isBlank();
  }
}
