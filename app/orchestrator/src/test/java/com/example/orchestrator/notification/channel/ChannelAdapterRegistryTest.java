package com.example.orchestrator.notification.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.orchestrator.notification.model.DeliveryError;
import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationEndpointRecord;
import com.example.orchestrator.notification.model.NotificationEventType;
import com.example.orchestrator.notification.model.NotificationPayload;
import com.example.orchestrator.notification.model.NotificationTypeMask;
import java.util.List;
import org.junit.jupiter.api.Test;

class ChannelAdapterRegistryTest {

  private static final NotificationPayload PAYLOAD =
      NotificationPayload.of(NotificationEventType.TEST_NOTIFICATION, null, "hello");

  @Test
  void rejectsDuplicateAdapters() {
    assertThatThrownBy(
            () ->
                new ChannelAdapterRegistry(
                    List.of(
                        adapter(EndpointType.SLACK, DeliveryResult.success()),
                        adapter(EndpointType.SLACK, DeliveryResult.success()))))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void missingAdapterIsInvalidConfig() {
    final ChannelAdapterRegistry registry = new ChannelAdapterRegistry(List.of());

    final DeliveryResult result = registry.deliver(endpoint(EndpointType.GOTIFY), PAYLOAD);

    assertThat(result.error().kind()).isEqualTo(DeliveryError.Kind.INVALID_CONFIG);
  }

  @Test
  void nullResultIsInternalError() {
    final ChannelAdapterRegistry registry =
        new ChannelAdapterRegistry(List.of(adapter(EndpointType.GOTIFY, null)));

    final DeliveryResult result = registry.deliver(endpoint(EndpointType.GOTIFY), PAYLOAD);

    assertThat(result.error().kind()).isEqualTo(DeliveryError.Kind.INTERNAL);
  }

  @Test
  void missingConfigValueIsInvalidConfig() {
    final NotificationChannelAdapter adapter =
        new NotificationChannelAdapter() {
          @Override
          public EndpointType type() {
            return EndpointType.GOTIFY;
          }

          @Override
          public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
            config.requireText("token");
            return DeliveryResult.success();
          }
        };
    final ChannelAdapterRegistry registry = new ChannelAdapterRegistry(List.of(adapter));

    final DeliveryResult result = registry.deliver(endpoint(EndpointType.GOTIFY), PAYLOAD);

    assertThat(result.error().kind()).isEqualTo(DeliveryError.Kind.INVALID_CONFIG);
    assertThat(result.error().message()).isEqualTo("token is not configured");
  }

  private static NotificationChannelAdapter adapter(EndpointType type, DeliveryResult result) {
    return new NotificationChannelAdapter() {
      @Override
      public EndpointType type() {
        return type;
      }

      @Override
      public DeliveryResult send(EndpointConfig config, NotificationPayload payload) {
        return result;
      }
    };
  }

  private static NotificationEndpointRecord endpoint(EndpointType type) {
    return new NotificationEndpointRecord(
        1L, "e", type, true, true, NotificationTypeMask.ALL, EndpointConfig.empty(), null, null);
  }
}
