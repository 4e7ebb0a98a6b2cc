/*
 * どこで: Notification サービス層
 * 何を: チャネル別の配信結果とファンアウト所要時間を記録する
 * なぜ: 外部チャネル障害を Prometheus から種別単位で観測できるようにするため
 */
package com.example.orchestrator.notification.service;

import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationEventType;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationMetrics {

  static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";
  static final String METRIC_DISPATCH_DURATION = "notification.dispatch.duration";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<NotificationEventType, Timer> dispatchTimers =
      new ConcurrentHashMap<>();

  public NotificationMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
  }

  public void recordDelivery(EndpointType channel, DeliveryResult result) {
    final String channelTag = channel.key();
    final String resultTag =
        result.ok() ? "success" : result.error().kind().name().toLowerCase(Locale.ROOT);
    deliveryCounters
        .computeIfAbsent(
            channelTag + ":" + resultTag,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Notification delivery outcomes per channel")
                    .tags(Tags.of("channel", channelTag, "result", resultTag))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDispatch(NotificationEventType eventType, Duration duration) {
    dispatchTimers
        .computeIfAbsent(
            eventType,
            type ->
                Timer.builder(METRIC_DISPATCH_DURATION)
                    .description("Time to fan out one notification event")
                    .tags(Tags.of("event", type.key()))
                    .register(meterRegistry))
        .record(duration);
  }
}
