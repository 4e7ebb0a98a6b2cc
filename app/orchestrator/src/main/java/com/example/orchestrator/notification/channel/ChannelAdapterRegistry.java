/*
 * どこで: Notification チャネル層
 * 何を: 種別からアダプタを解決し、送信を例外から隔離して実行する
 * なぜ: 1 つのアダプタの予期しない例外がファンアウト全体を壊さないようにするため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.notification.model.DeliveryError;
import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationEndpointRecord;
import com.example.orchestrator.notification.model.NotificationPayload;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class ChannelAdapterRegistry {

  private static final Logger logger = LoggerFactory.getLogger(ChannelAdapterRegistry.class);

  private final Map<EndpointType, NotificationChannelAdapter> adapters =
      new EnumMap<>(EndpointType.class);

  public ChannelAdapterRegistry(List<NotificationChannelAdapter> adapters) {
    for (NotificationChannelAdapter adapter : adapters) {
      final NotificationChannelAdapter previous = this.adapters.put(adapter.type(), adapter);
      if (previous != null) {
        throw new IllegalStateException("duplicate notification adapter for " + adapter.type());
      }
    }
  }

  public Optional<NotificationChannelAdapter> find(EndpointType type) {
    return Optional.ofNullable(adapters.get(type));
  }

  /** アダプタを呼び出す。例外は DeliveryResult へ変換し、呼び出し元へは投げない。 */
  public DeliveryResult deliver(NotificationEndpointRecord endpoint, NotificationPayload payload) {
    final Optional<NotificationChannelAdapter> adapter = find(endpoint.type());
    if (adapter.isEmpty()) {
      return DeliveryResult.failure(
          DeliveryError.Kind.INVALID_CONFIG, "no adapter for type " + endpoint.type());
    }
    try {
      final DeliveryResult result = adapter.get().send(endpoint.config(), payload);
      return result == null
          ? DeliveryResult.failure(DeliveryError.Kind.INTERNAL, "adapter returned no result")
          : result;
    } catch (EndpointConfig.MissingConfigValueException ex) {
      return DeliveryResult.failure(DeliveryError.Kind.INVALID_CONFIG, ex.getMessage());
    } catch (RuntimeException ex) {
      logger.error(
          "notification adapter threw endpointId={} type={}", endpoint.id(), endpoint.type(), ex);
      return DeliveryResult.failure(
          DeliveryError.Kind.INTERNAL, ex.getClass().getSimpleName() + ": " + ex.getMessage());
    }
  }
}
