/*
 * どこで: Scheduler サービス層
 * 何を: ジョブ 1 回分の実行 (排他/タイムアウト/履歴/次回計算/失敗通知) を担う
 * なぜ: tick 経由と手動実行で同じ後処理を保証するため
 */
package com.example.orchestrator.scheduler.service;

import com.example.orchestrator.config.ExecutorConfig;
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
import com.google.common.annotations.VisibleForTesting;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "ExecutorService/リポジトリは Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class JobExecutionService {

  private static final Logger logger = LoggerFactory.getLogger(JobExecutionService.class);
  private static final String MDC_JOB_NAME = "job_name";
  private static final long FALLBACK_INTERVAL_SECONDS = 3600;
  static final String NO_HANDLER_MESSAGE = "no handler registered";

  private final ExecutorService jobExecutor;
  private final ExecutorService jobWorkExecutor;
  private final JobRepository jobRepository;
  private final JobHistoryRepository historyRepository;
  private final JobHandlerRegistry handlerRegistry;
  private final JobLockRegistry lockRegistry;
  private final JobRuntimeMetricsRegistry runtimeMetrics;
  private final JobMetrics jobMetrics;
  private final ScheduleCalculator scheduleCalculator;
  private final NotificationDispatcher dispatcher;
  private final SchedulerProperties properties;
  private final int errorMessageMaxLength;
  private final Clock clock;

  public JobExecutionService(
      @Qualifier(ExecutorConfig.JOB_EXECUTOR) ExecutorService jobExecutor,
      @Qualifier(ExecutorConfig.JOB_WORK_EXECUTOR) ExecutorService jobWorkExecutor,
      JobRepository jobRepository,
      JobHistoryRepository historyRepository,
      JobHandlerRegistry handlerRegistry,
      JobLockRegistry lockRegistry,
      JobRuntimeMetricsRegistry runtimeMetrics,
      JobMetrics jobMetrics,
      ScheduleCalculator scheduleCalculator,
      NotificationDispatcher dispatcher,
      SchedulerProperties properties,
      NotificationDeliveryProperties deliveryProperties,
      Clock clock) {
    this.jobExecutor = jobExecutor;
    this.jobWorkExecutor = jobWorkExecutor;
    this.jobRepository = jobRepository;
    this.historyRepository = historyRepository;
    this.handlerRegistry = handlerRegistry;
    this.lockRegistry = lockRegistry;
    this.runtimeMetrics = runtimeMetrics;
    this.jobMetrics = jobMetrics;
    this.scheduleCalculator = scheduleCalculator;
    this.dispatcher = dispatcher;
    this.properties = properties;
    this.errorMessageMaxLength = deliveryProperties.errorMessageMaxLength();
    this.clock = clock;
  }

  /**
   * 呼び出し元スレッドでジョブを実行する。tick ループとは独立して動く。
   *
   * <p>同名ジョブが実行中なら何もせず {@code ALREADY_RUNNING} を返す。タイムアウトしたハンドラが
   * まだ動いている場合も実行中として扱う。
   */
  public RunNowResult runNow(String jobName) {
    final Optional<JobHandler> handler = handlerRegistry.find(jobName);
    if (handler.isEmpty()) {
      return RunNowResult.noHandler();
    }
    if (!lockRegistry.tryAcquire(jobName)) {
      jobMetrics.recordSkipped(jobName);
      logger.info("job already running, manual run skipped job={}", jobName);
      return RunNowResult.alreadyRunning();
    }
    return RunNowResult.completed(runLocked(jobName, handler.get(), JobTrigger.MANUAL));
  }

  /**
   * tick から呼ばれ、ジョブをワーカープールへ投入する。
   *
   * @return 投入できた場合 true。実行中または投入拒否なら false
   */
  public boolean submit(String jobName) {
    if (!lockRegistry.tryAcquire(jobName)) {
      jobMetrics.recordSkipped(jobName);
      logger.debug("job still running, tick skipped job={}", jobName);
      return false;
    }
    try {
      jobExecutor.execute(
          () -> {
            final Optional<JobHandler> handler = handlerRegistry.find(jobName);
            if (handler.isPresent()) {
              runLocked(jobName, handler.get(), JobTrigger.SCHEDULE);
              return;
            }
            try {
              recordMissingHandler(jobName);
            } finally {
              lockRegistry.release(jobName);
            }
          });
      return true;
    } catch (RejectedExecutionException ex) {
      lockRegistry.release(jobName);
      logger.warn("job submission rejected job={}", jobName, ex);
      return false;
    }
  }

  /**
   * ロック取得済みのジョブを実行して記録する。ロックの解放はこのメソッドが引き受け、ハンドラが
   * 実際に終了するまで保持する。
   */
  @VisibleForTesting
  JobRunRecord runLocked(String jobName, JobHandler handler, JobTrigger trigger) {
    final LockedJobWork work = new LockedJobWork(jobName, handler, lockRegistry);
    MDC.put(MDC_JOB_NAME, jobName);
    try {
      final Instant startedAt = clock.instant();
      final long startNanos = System.nanoTime();
      final Duration timeout = properties.timeoutFor(jobName);
      JobRunStatus status = JobRunStatus.SUCCESS;
      String details = null;
      String error = null;
      logger.info("job started job={} trigger={}", jobName, trigger);
      Future<String> future = null;
      try {
        future = jobWorkExecutor.submit(work);
        details = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException ex) {
        work.notStarted();
        status = JobRunStatus.FAILED;
        error = "rejected by worker pool";
      } catch (TimeoutException ex) {
        work.abandon();
        status = JobRunStatus.FAILED;
        error = "timed out after " + timeout.toSeconds() + "s";
      } catch (ExecutionException ex) {
        status = JobRunStatus.FAILED;
        error = describe(ex.getCause() == null ? ex : ex.getCause());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        work.abandon();
        status = JobRunStatus.FAILED;
        error = "interrupted";
      }
      if (future != null && !future.isDone()) {
        logger.warn("job handler still running after timeout, lock kept job={}", jobName);
      }
      final Instant finishedAt = clock.instant();
      final long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
      final JobRunRecord run =
          new JobRunRecord(
              null,
              jobName,
              trigger,
              status,
              startedAt,
              finishedAt,
              durationMs,
              truncate(error),
              truncate(details));
      if (status == JobRunStatus.SUCCESS) {
        logger.info("job finished job={} durationMs={}", jobName, durationMs);
      } else {
        logger.warn(
            "job failed job={} durationMs={} error={}", jobName, durationMs, run.errorMessage());
      }
      return complete(run);
    } finally {
      work.callerDone();
      MDC.remove(MDC_JOB_NAME);
    }
  }

  private void recordMissingHandler(String jobName) {
    final Instant now = clock.instant();
    logger.error("no handler registered job={}", jobName);
    complete(
        new JobRunRecord(
            null,
            jobName,
            JobTrigger.SCHEDULE,
            JobRunStatus.FAILED,
            now,
            now,
            0,
            NO_HANDLER_MESSAGE,
            null));
  }

  /** 実行後の記録処理。個々の失敗はログに残し、後続の記録を止めない。 */
  private JobRunRecord complete(JobRunRecord run) {
    final boolean success = run.status() == JobRunStatus.SUCCESS;
    try {
      final Optional<JobRecord> job = jobRepository.findByName(run.jobName());
      if (job.isPresent()) {
        final Instant nextRunAt = nextRunAfter(job.get(), run.finishedAt());
        jobRepository.recordCompletion(
            run.jobName(), run.finishedAt(), nextRunAt, success, run.errorMessage());
      }
    } catch (DataAccessException ex) {
      logger.error("failed to record job completion job={}", run.jobName(), ex);
    }
    JobRunRecord stored = run;
    try {
      stored = run.withId(historyRepository.insert(run));
    } catch (DataAccessException ex) {
      logger.error("failed to append job history job={}", run.jobName(), ex);
    }
    runtimeMetrics.record(stored);
    jobMetrics.recordRun(run.jobName(), run.status(), Duration.ofMillis(run.durationMs()));
    if (!success && properties.notifyOnFailure()) {
      notifyFailure(stored);
    }
    return stored;
  }

  private Instant nextRunAfter(JobRecord job, Instant finishedAt) {
    try {
      return scheduleCalculator.computeNextRun(job.schedule(), job.intervalSeconds(), finishedAt);
    } catch (InvalidScheduleException ex) {
      logger.error(
          "stored schedule is invalid, falling back to interval job={} schedule={}",
          job.name(),
          job.schedule(),
          ex);
      final long interval =
          job.intervalSeconds() > 0 ? job.intervalSeconds() : FALLBACK_INTERVAL_SECONDS;
      return finishedAt.plusSeconds(interval);
    }
  }

  private void notifyFailure(JobRunRecord run) {
    final NotificationPayload payload =
        NotificationPayload.of(
                NotificationEventType.JOB_FAILED,
                "Job Failed: " + run.jobName(),
                run.errorMessage() == null ? "" : run.errorMessage())
            .withField("Job", run.jobName())
            .withField("Trigger", run.trigger().name());
    dispatcher.dispatchAsync(NotificationEventType.JOB_FAILED, payload, DispatchScope.all());
  }

  private static String describe(Throwable cause) {
    final String message = cause.getMessage();
    return message == null || message.isBlank()
        ? cause.getClass().getSimpleName()
        : cause.getClass().getSimpleName() + ": " + message;
  }

  private String truncate(String value) {
    if (value == null || value.length() <= errorMessageMaxLength) {
      return value;
    }
    return value.substring(0, errorMessageMaxLength);
  }
}
