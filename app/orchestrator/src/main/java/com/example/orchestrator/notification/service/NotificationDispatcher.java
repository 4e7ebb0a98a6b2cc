/*
 * どこで: Notification サービス層
 * 何を: イベントに一致するエンドポイントを抽出し、チャネルアダプタへ並列に送信する
 * なぜ: 1 つのチャネル障害が他の配信を遅延/阻害しないようにするため
 */
package com.example.orchestrator.notification.service;

import com.example.orchestrator.config.ExecutorConfig;
import com.example.orchestrator.config.NotificationDeliveryProperties;
import com.example.orchestrator.notification.channel.ChannelAdapterRegistry;
import com.example.orchestrator.notification.model.DeliveryAttempt;
import com.example.orchestrator.notification.model.DeliveryError;
import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.DispatchScope;
import com.example.orchestrator.notification.model.DispatchSummary;
import com.example.orchestrator.notification.model.NotificationEndpointRecord;
import com.example.orchestrator.notification.model.NotificationEventType;
import com.example.orchestrator.notification.model.NotificationPayload;
import com.example.orchestrator.notification.repository.NotificationEndpointRepository;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ExecutorService は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class NotificationDispatcher {

  private static final Logger logger = LoggerFactory.getLogger(NotificationDispatcher.class);

  private final NotificationEndpointRepository endpointRepository;
  private final ChannelAdapterRegistry adapterRegistry;
  private final NotificationMetrics metrics;
  private final NotificationDeliveryProperties properties;
  private final ExecutorService sendExecutor;
  private final ExecutorService eventExecutor;
  private final Clock clock;

  public NotificationDispatcher(
      NotificationEndpointRepository endpointRepository,
      ChannelAdapterRegistry adapterRegistry,
      NotificationMetrics metrics,
      NotificationDeliveryProperties properties,
      @Qualifier(ExecutorConfig.NOTIFICATION_SEND_EXECUTOR) ExecutorService sendExecutor,
      @Qualifier(ExecutorConfig.NOTIFICATION_EVENT_EXECUTOR) ExecutorService eventExecutor,
      Clock clock) {
    this.endpointRepository = endpointRepository;
    this.adapterRegistry = adapterRegistry;
    this.metrics = metrics;
    this.properties = properties;
    this.sendExecutor = sendExecutor;
    this.eventExecutor = eventExecutor;
    this.clock = clock;
  }

  /**
   * 一致する全エンドポイントへ送信し、結果を集計して返す。
   *
   * <p>個々の送信失敗は集計に数えるだけで例外にはしない。エンドポイント設定は呼び出しごとに読み直す。
   */
  public DispatchSummary dispatch(
      NotificationEventType eventType, NotificationPayload payload, DispatchScope scope) {
    Objects.requireNonNull(eventType, "eventType is required");
    Objects.requireNonNull(payload, "payload is required");
    Objects.requireNonNull(scope, "scope is required");
    final long startedNanos = System.nanoTime();
    final List<NotificationEndpointRecord> targets =
        endpointRepository.findDispatchTargets(eventType, scope).stream()
            .filter(endpoint -> endpoint.accepts(eventType))
            .toList();
    if (targets.isEmpty()) {
      logger.debug("no notification endpoint matched eventType={}", eventType.key());
      metrics.recordDispatch(eventType, Duration.ofNanos(System.nanoTime() - startedNanos));
      return DispatchSummary.empty(eventType);
    }

    final List<CompletableFuture<DeliveryAttempt>> futures =
        targets.stream().map(endpoint -> sendAsync(endpoint, payload)).toList();
    final List<DeliveryAttempt> attempts = futures.stream().map(CompletableFuture::join).toList();
    for (DeliveryAttempt attempt : attempts) {
      if (!attempt.ok() && attempt.error().kind() == DeliveryError.Kind.SUBSCRIPTION_GONE) {
        disableGoneEndpoint(attempt.endpointId());
      }
    }

    final DispatchSummary summary = DispatchSummary.of(eventType, attempts);
    metrics.recordDispatch(eventType, Duration.ofNanos(System.nanoTime() - startedNanos));
    logger.info(
        "notification dispatched eventType={} matched={} delivered={} failed={}",
        eventType.key(),
        summary.matched(),
        summary.delivered(),
        summary.failed());
    return summary;
  }

  /** 呼び出し元を待たせずに dispatch する。失敗はログに残して future に載せる。 */
  public CompletableFuture<DispatchSummary> dispatchAsync(
      NotificationEventType eventType, NotificationPayload payload, DispatchScope scope) {
    try {
      return CompletableFuture.supplyAsync(() -> dispatch(eventType, payload, scope), eventExecutor)
          .whenComplete(
              (summary, ex) -> {
                if (ex != null) {
                  logger.error("notification dispatch failed eventType={}", eventType, ex);
                }
              });
    } catch (RejectedExecutionException ex) {
      logger.error("notification dispatch rejected eventType={}", eventType, ex);
      return CompletableFuture.failedFuture(ex);
    }
  }

  /**
   * 有効フラグとイベントマスクを無視して固定のテスト通知を送る。
   *
   * @throws NotificationEndpointNotFoundException エンドポイントが存在しない場合
   */
  public DeliveryResult sendTest(long endpointId) {
    final NotificationEndpointRecord endpoint =
        endpointRepository
            .findById(endpointId)
            .orElseThrow(() -> new NotificationEndpointNotFoundException(endpointId));
    final NotificationPayload payload =
        NotificationPayload.of(
            NotificationEventType.TEST_NOTIFICATION,
            "Test Notification",
            "This is a test notification from " + properties.appName() + ".");
    final DeliveryResult result = adapterRegistry.deliver(endpoint, payload);
    metrics.recordDelivery(endpoint.type(), result);
    if (result.ok()) {
      logger.info("test notification sent endpointId={} type={}", endpoint.id(), endpoint.type());
    } else {
      logFailure(endpoint, result.error());
    }
    return result;
  }

  private CompletableFuture<DeliveryAttempt> sendAsync(
      NotificationEndpointRecord endpoint, NotificationPayload payload) {
    final long startedNanos = System.nanoTime();
    CompletableFuture<DeliveryResult> future;
    try {
      future =
          CompletableFuture.supplyAsync(
              () -> adapterRegistry.deliver(endpoint, payload), sendExecutor);
    } catch (RejectedExecutionException ex) {
      future =
          CompletableFuture.completedFuture(
              DeliveryResult.failure(DeliveryError.Kind.INTERNAL, "send executor rejected task"));
    }
    return future
        .completeOnTimeout(
            DeliveryResult.failure(
                DeliveryError.Kind.TIMEOUT,
                "send timed out after " + properties.sendTimeout().toMillis() + "ms"),
            properties.sendTimeout().toMillis(),
            TimeUnit.MILLISECONDS)
        .exceptionally(
            ex ->
                DeliveryResult.failure(
                    DeliveryError.Kind.INTERNAL, String.valueOf(ex.getMessage())))
        .thenApply(
            result -> {
              metrics.recordDelivery(endpoint.type(), result);
              if (!result.ok()) {
                logFailure(endpoint, result.error());
              }
              return DeliveryAttempt.from(
                  endpoint,
                  result,
                  TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos));
            });
  }

  private void disableGoneEndpoint(long endpointId) {
    try {
      endpointRepository.updateEnabled(endpointId, false, clock.instant());
      logger.info(
          "notification endpoint disabled because subscription is gone endpointId={}",
          endpointId);
    } catch (RuntimeException ex) {
      logger.warn("failed to disable gone notification endpoint endpointId={}", endpointId, ex);
    }
  }

  private void logFailure(NotificationEndpointRecord endpoint, DeliveryError error) {
    logger.warn(
        "notification delivery failed endpointId={} type={} kind={} status={} message={}",
        endpoint.id(),
        endpoint.type(),
        error.kind(),
        error.httpStatus(),
        error.message());
  }
}
