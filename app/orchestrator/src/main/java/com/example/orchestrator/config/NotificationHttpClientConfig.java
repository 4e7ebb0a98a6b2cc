/*
 * どこで: Orchestrator 設定
 * 何を: 通知チャネル呼び出し専用 RestClient を提供する
 * なぜ: 外部 Webhook の応答遅延を接続/読み取りタイムアウトで打ち切るため
 */
package com.example.orchestrator.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class NotificationHttpClientConfig {

  @Bean
  RestClient notificationRestClient(
      RestClient.Builder builder, NotificationDeliveryProperties properties) {
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.httpConnectTimeout());
    requestFactory.setReadTimeout(properties.httpReadTimeout());
    return builder.requestFactory(requestFactory).build();
  }
}
