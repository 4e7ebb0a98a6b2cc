/*
 * どこで: Orchestrator 設定バインド
 * 何を: 内部イベント受付 API のトークン設定を保持する
 * なぜ: ポータル本体との共有シークレットを外部化するため
 */
package com.example.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "internal-api")
public record InternalApiProperties(String tokenHeader, String token) {

  public InternalApiProperties {
    tokenHeader = tokenHeader == null || tokenHeader.isBlank() ? "X-Internal-Token" : tokenHeader;
  }
}
