/*
 * どこで: Scheduler ジョブ実行サービスのユニットテスト
 * 何を: 排他/タイムアウト/失敗時の記録と通知を検証する
 * なぜ: 同一ジョブの二重実行や記録漏れが起きないことを保証するため
 */
package com.example.orchestrator.scheduler.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.orchestrator.config.NotificationDeliveryProperties;
import com.example.orchestrator.config.SchedulerProperties;
import com.example.orchestrator.notification.model.DispatchScope;
import com.example.orchestrator.notification.model.NotificationEventType;
import com.example.orchestrator.notification.model.NotificationPayload;
import com.example.orchestrator.notification.service.NotificationDispatcher;
import com.example.orchestrator.scheduler.handler.JobHandler;
import com.example.orchestrator.scheduler.model.JobRecord;
import com.example.orchestrator.scheduler.model.JobRunRecord;
import com.example.orchestrator.scheduler.model.JobRunStatus;
import com.example.orchestrator.scheduler.model.JobTrigger;
import com.example.orchestrator.scheduler.model.RunNowResult;
import com.example.orchestrator.scheduler.repository.JobHistoryRepository;
import com.example.orchestrator.scheduler.repository.JobRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class JobExecutionServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T00:00:00Z");
  private static final String JOB_NAME = "library-scan";

  @Mock private JobRepository jobRepository;
  @Mock private JobHistoryRepository historyRepository;
  @Mock private NotificationDispatcher dispatcher;

  private final ExecutorService jobExecutor = Executors.newFixedThreadPool(2);
  private final ExecutorService jobWorkExecutor = Executors.newCachedThreadPool();
  private final ExecutorService callers = Executors.newCachedThreadPool();
  private final JobLockRegistry lockRegistry = new JobLockRegistry();
  private final JobRuntimeMetricsRegistry runtimeMetrics = new JobRuntimeMetricsRegistry();

  @AfterEach
  void tearDown() {
    jobExecutor.shutdownNow();
    jobWorkExecutor.shutdownNow();
    callers.shutdownNow();
  }

  @Test
  void runNowRecordsSuccessAndSchedulesNextRunFromCompletion() {
    when(jobRepository.findByName(JOB_NAME)).thenReturn(Optional.of(job(JOB_NAME, 3600)));
    when(historyRepository.insert(any())).thenReturn(42L);
    final JobExecutionService service = service(handler(JOB_NAME, () -> "scanned 12"), false);

    final RunNowResult result = service.runNow(JOB_NAME);

    assertThat(result.outcome()).isEqualTo(RunNowResult.Outcome.COMPLETED);
    assertThat(result.run().id()).isEqualTo(42L);
    assertThat(result.run().status()).isEqualTo(JobRunStatus.SUCCESS);
    assertThat(result.run().trigger()).isEqualTo(JobTrigger.MANUAL);
    assertThat(result.run().details()).isEqualTo("scanned 12");
    verify(jobRepository)
        .recordCompletion(
            eq(JOB_NAME), eq(FIXED_NOW), eq(FIXED_NOW.plusSeconds(3600)), eq(true), isNull());
    assertThat(runtimeMetrics.find(JOB_NAME).orElseThrow().successRuns()).isEqualTo(1);
    assertThat(lockRegistry.isRunning(JOB_NAME)).isFalse();
  }

  @Test
  void concurrentRunNowExecutesOnceAndReportsAlreadyRunning() throws Exception {
    when(jobRepository.findByName(JOB_NAME)).thenReturn(Optional.of(job(JOB_NAME, 3600)));
    final CountDownLatch started = new CountDownLatch(1);
    final CountDownLatch release = new CountDownLatch(1);
    final JobExecutionService service =
        service(
            handler(
                JOB_NAME,
                () -> {
                  started.countDown();
                  release.await(5, TimeUnit.SECONDS);
                  return "done";
                }),
            false);

    final Future<RunNowResult> first = callers.submit(() -> service.runNow(JOB_NAME));
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    final RunNowResult second = service.runNow(JOB_NAME);
    release.countDown();

    assertThat(second.outcome()).isEqualTo(RunNowResult.Outcome.ALREADY_RUNNING);
    assertThat(first.get(5, TimeUnit.SECONDS).outcome())
        .isEqualTo(RunNowResult.Outcome.COMPLETED);
    verify(historyRepository, times(1)).insert(any());
  }

  @Test
  void timeoutIsRecordedAsFailureAndInterruptsHandler() throws Exception {
    when(jobRepository.findByName(JOB_NAME)).thenReturn(Optional.of(job(JOB_NAME, 3600)));
    final CountDownLatch interrupted = new CountDownLatch(1);
    final JobExecutionService service =
        service(
            handler(
                JOB_NAME,
                () -> {
                  try {
                    Thread.sleep(10_000);
                  } catch (InterruptedException ex) {
                    interrupted.countDown();
                    throw ex;
                  }
                  return "never";
                }),
            false,
            Map.of(JOB_NAME, Duration.ofMillis(100)));

    final RunNowResult result = service.runNow(JOB_NAME);

    assertThat(result.run().status()).isEqualTo(JobRunStatus.FAILED);
    assertThat(result.run().errorMessage()).startsWith("timed out");
    assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    verify(jobRepository).recordCompletion(eq(JOB_NAME), any(), any(), eq(false), anyString());
  }

  @Test
  void timedOutHandlerIgnoringInterruptKeepsJobLockedUntilItReturns() throws Exception {
    when(jobRepository.findByName(JOB_NAME)).thenReturn(Optional.of(job(JOB_NAME, 3600)));
    final AtomicInteger inFlight = new AtomicInteger();
    final AtomicInteger maxInFlight = new AtomicInteger();
    final CountDownLatch finish = new CountDownLatch(1);
    final CountDownLatch stubborn = new CountDownLatch(1);
    final JobExecutionService service =
        service(
            handler(
                JOB_NAME,
                () -> {
                  maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                  try {
                    if (stubborn.getCount() > 0) {
                      stubborn.countDown();
                      awaitIgnoringInterrupts(finish);
                    }
                    return "done";
                  } finally {
                    inFlight.decrementAndGet();
                  }
                }),
            false,
            Map.of(JOB_NAME, Duration.ofMillis(100)));

    final RunNowResult first = service.runNow(JOB_NAME);
    final RunNowResult second = service.runNow(JOB_NAME);

    assertThat(first.run().status()).isEqualTo(JobRunStatus.FAILED);
    assertThat(second.outcome()).isEqualTo(RunNowResult.Outcome.ALREADY_RUNNING);
    assertThat(service.submit(JOB_NAME)).isFalse();
    assertThat(lockRegistry.isRunning(JOB_NAME)).isTrue();

    finish.countDown();
    await(() -> !lockRegistry.isRunning(JOB_NAME));

    final RunNowResult third = service.runNow(JOB_NAME);
    assertThat(third.outcome()).isEqualTo(RunNowResult.Outcome.COMPLETED);
    assertThat(third.run().status()).isEqualTo(JobRunStatus.SUCCESS);
    assertThat(maxInFlight.get()).isEqualTo(1);
    assertThat(lockRegistry.isRunning(JOB_NAME)).isFalse();
  }

  @Test
  void finishedRunReleasesLockBeforeReturning() {
    when(jobRepository.findByName(JOB_NAME)).thenReturn(Optional.of(job(JOB_NAME, 3600)));
    final JobExecutionService service = service(handler(JOB_NAME, () -> "ok"), false);

    service.runNow(JOB_NAME);

    assertThat(lockRegistry.isRunning(JOB_NAME)).isFalse();
    assertThat(service.runNow(JOB_NAME).outcome()).isEqualTo(RunNowResult.Outcome.COMPLETED);
  }

  @Test
  void failureIsRecordedAndNotifiesJobFailed() {
    when(jobRepository.findByName(JOB_NAME)).thenReturn(Optional.of(job(JOB_NAME, 3600)));
    final JobExecutionService service =
        service(
            handler(
                JOB_NAME,
                () -> {
                  throw new IllegalStateException("library path missing");
                }),
            true);

    final RunNowResult result = service.runNow(JOB_NAME);

    assertThat(result.run().status()).isEqualTo(JobRunStatus.FAILED);
    assertThat(result.run().errorMessage())
        .isEqualTo("IllegalStateException: library path missing");
    final ArgumentCaptor<NotificationPayload> payload =
        ArgumentCaptor.forClass(NotificationPayload.class);
    verify(dispatcher)
        .dispatchAsync(
            eq(NotificationEventType.JOB_FAILED), payload.capture(), eq(DispatchScope.all()));
    assertThat(payload.getValue().title()).contains(JOB_NAME);
    assertThat(payload.getValue().message()).contains("library path missing");
    assertThat(runtimeMetrics.find(JOB_NAME).orElseThrow().failedRuns()).isEqualTo(1);
  }

  @Test
  void failureWithoutNotificationDoesNotDispatch() {
    when(jobRepository.findByName(JOB_NAME)).thenReturn(Optional.of(job(JOB_NAME, 3600)));
    final JobExecutionService service =
        service(
            handler(
                JOB_NAME,
                () -> {
                  throw new IllegalStateException("x");
                }),
            false);

    service.runNow(JOB_NAME);

    verify(dispatcher, never()).dispatchAsync(any(), any(), any());
  }

  @Test
  void runNowWithoutHandlerReportsNoHandler() {
    final JobExecutionService service = service(handler("other", () -> "ok"), false);

    assertThat(service.runNow(JOB_NAME).outcome()).isEqualTo(RunNowResult.Outcome.NO_HANDLER);
    verify(historyRepository, never()).insert(any());
  }

  @Test
  void invalidStoredScheduleFallsBackToDefaultInterval() {
    final JobRecord broken =
        new JobRecord(
            1L, JOB_NAME, "", "bad cron", 0, true, false, null, null, 0, null, FIXED_NOW,
            FIXED_NOW);
    when(jobRepository.findByName(JOB_NAME)).thenReturn(Optional.of(broken));
    final JobExecutionService service = service(handler(JOB_NAME, () -> "ok"), false);

    service.runNow(JOB_NAME);

    verify(jobRepository)
        .recordCompletion(
            eq(JOB_NAME), eq(FIXED_NOW), eq(FIXED_NOW.plusSeconds(3600)), eq(true), isNull());
  }

  @Test
  void submitRunsOnWorkerPoolAndReleasesLock() {
    when(jobRepository.findByName(JOB_NAME)).thenReturn(Optional.of(job(JOB_NAME, 60)));
    final JobExecutionService service = service(handler(JOB_NAME, () -> "ok"), false);

    assertThat(service.submit(JOB_NAME)).isTrue();

    final ArgumentCaptor<JobRunRecord> run = ArgumentCaptor.forClass(JobRunRecord.class);
    verify(historyRepository, timeout(5000)).insert(run.capture());
    assertThat(run.getValue().trigger()).isEqualTo(JobTrigger.SCHEDULE);
    assertThat(run.getValue().status()).isEqualTo(JobRunStatus.SUCCESS);
  }

  @Test
  void submitSkipsJobThatIsAlreadyRunning() {
    final JobExecutionService service = service(handler(JOB_NAME, () -> "ok"), false);
    lockRegistry.tryAcquire(JOB_NAME);

    assertThat(service.submit(JOB_NAME)).isFalse();
    verify(historyRepository, never()).insert(any());
  }

  @Test
  void submitWithoutHandlerRecordsFailedRun() {
    final JobExecutionService service = service(handler("other", () -> "ok"), false);

    assertThat(service.submit(JOB_NAME)).isTrue();

    final ArgumentCaptor<JobRunRecord> run = ArgumentCaptor.forClass(JobRunRecord.class);
    verify(historyRepository, timeout(5000)).insert(run.capture());
    assertThat(run.getValue().status()).isEqualTo(JobRunStatus.FAILED);
    assertThat(run.getValue().errorMessage()).isEqualTo(JobExecutionService.NO_HANDLER_MESSAGE);
  }

  private JobExecutionService service(JobHandler handler, boolean notifyOnFailure) {
    return service(handler, notifyOnFailure, Map.of());
  }

  private JobExecutionService service(
      JobHandler handler, boolean notifyOnFailure, Map<String, Duration> jobTimeouts) {
    final SchedulerProperties properties =
        new SchedulerProperties(
            true, null, Duration.ofSeconds(5), jobTimeouts, 2, notifyOnFailure, 30, "UTC");
    final NotificationDeliveryProperties deliveryProperties =
        new NotificationDeliveryProperties(null, null, null, null, 0, null, 200);
    return new JobExecutionService(
        jobExecutor,
        jobWorkExecutor,
        jobRepository,
        historyRepository,
        new JobHandlerRegistry(List.of(handler)),
        lockRegistry,
        runtimeMetrics,
        new JobMetrics(new SimpleMeterRegistry(), lockRegistry),
        new ScheduleCalculator(properties),
        dispatcher,
        properties,
        deliveryProperties,
        Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  private static JobRecord job(String name, long intervalSeconds) {
    return new JobRecord(
        1L, name, "", null, intervalSeconds, true, false, null, FIXED_NOW, 0, null, FIXED_NOW,
        FIXED_NOW);
  }

  private static void awaitIgnoringInterrupts(CountDownLatch latch) {
    while (true) {
      try {
        if (latch.await(5, TimeUnit.SECONDS)) {
          return;
        }
      } catch (InterruptedException ignored) {
        // 割り込みに応じないハンドラを再現する
      }
    }
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (!condition.getAsBoolean()) {
      assertThat(System.nanoTime()).isLessThan(deadline);
      Thread.sleep(10);
    }
  }

  private static JobHandler handler(String name, Callable<String> body) {
    return new JobHandler() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public String run() throws Exception {
        return body.call();
      }
    };
  }
}
