/*
 * どこで: Notification チャネル層
 * 何を: ブラウザ購読先へ Web Push を送り、失効した購読を判別する
 * なぜ: 404/410 を SUBSCRIPTION_GONE として返し、呼び出し側で購読を無効化させるため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.notification.model.DeliveryError;
import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class WebPushChannelAdapter implements NotificationChannelAdapter {

  private static final Logger logger = LoggerFactory.getLogger(WebPushChannelAdapter.class);

  private final WebPushGateway gateway;
  private final ObjectMapper objectMapper;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public WebPushChannelAdapter(WebPushGateway gateway, ObjectMapper objectMapper) {
    this.gateway = gateway;
    this.objectMapper = objectMapper;
  }

  @Override
  public EndpointType type() {
    return EndpointType.WEB_PUSH;
  }

  @Override
  public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
    if (!gateway.available()) {
      return DeliveryResult.failure(
          DeliveryError.Kind.INVALID_CONFIG, "VAPID keys are not configured");
    }
    final byte[] body;
    try {
      body = objectMapper.writeValueAsBytes(buildBody(payload));
    } catch (JsonProcessingException ex) {
      return DeliveryResult.failure(DeliveryError.Kind.INTERNAL, "payload serialization failed");
    }
    try {
      final int status =
          gateway.send(
              config.requireText("endpoint"),
              config.requireText("p256dh"),
              config.requireText("auth"),
              body);
      return toResult(status);
    } catch (IOException ex) {
      if (ChannelHttpClient.isTimeout(ex)) {
        return DeliveryResult.failure(DeliveryError.Kind.TIMEOUT, "push request timed out");
      }
      logger.warn("web push request failed", ex);
      return DeliveryResult.failure(DeliveryError.Kind.NETWORK, String.valueOf(ex.getMessage()));
    } catch (GeneralSecurityException ex) {
      return DeliveryResult.failure(
          DeliveryError.Kind.INVALID_CONFIG, "subscription keys are invalid: " + ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return DeliveryResult.failure(DeliveryError.Kind.TIMEOUT, "push request interrupted");
    }
  }

  static DeliveryResult toResult(int status) {
    if (status >= 200 && status < 300) {
      return DeliveryResult.success();
    }
    if (status == 404 || status == 410) {
      return DeliveryResult.failure(
          new DeliveryError(DeliveryError.Kind.SUBSCRIPTION_GONE, "subscription expired", status));
    }
    return DeliveryResult.failure(DeliveryError.httpStatus(status, "push service rejected"));
  }

  Map<String, Object> buildBody(NotificationPayload payload) {
    final Map<String, Object> body = new LinkedHashMap<>();
    body.put("notification_type", payload.eventType().key());
    body.put("subject", payload.title());
    body.put("message", payload.message());
    if (payload.url() != null) {
      body.put("url", payload.url());
    }
    if (payload.imageUrl() != null) {
      body.put("image", payload.imageUrl());
    }
    return body;
  }
}
