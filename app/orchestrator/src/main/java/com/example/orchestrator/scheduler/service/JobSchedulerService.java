/*
 * どこで: Scheduler サービス層
 * 何を: ジョブ定義の参照/更新、手動実行、tick による期限到来ジョブの投入を提供する
 * なぜ: 管理 API とワーカーが同じ規則でジョブを扱うため
 */
package com.example.orchestrator.scheduler.service;

import com.example.orchestrator.scheduler.model.JobHistoryPage;
import com.example.orchestrator.scheduler.model.JobRecord;
import com.example.orchestrator.scheduler.model.JobRunRecord;
import com.example.orchestrator.scheduler.model.JobRuntimeMetric;
import com.example.orchestrator.scheduler.model.RunNowResult;
import com.example.orchestrator.scheduler.model.TickSummary;
import com.example.orchestrator.scheduler.repository.JobHistoryRepository;
import com.example.orchestrator.scheduler.repository.JobRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class JobSchedulerService {

  private static final Logger logger = LoggerFactory.getLogger(JobSchedulerService.class);
  public static final int MAX_HISTORY_PAGE_SIZE = 200;
  static final Duration NEXT_RUN_DRIFT_TOLERANCE = Duration.ofSeconds(60);

  private final JobRepository jobRepository;
  private final JobHistoryRepository historyRepository;
  private final JobExecutionService executionService;
  private final JobLockRegistry lockRegistry;
  private final JobRuntimeMetricsRegistry runtimeMetrics;
  private final ScheduleCalculator scheduleCalculator;
  private final Clock clock;

  public List<JobRecord> listJobs() {
    return jobRepository.findAll();
  }

  public JobRecord getJob(String name) {
    return jobRepository.findByName(name).orElseThrow(() -> JobNotFoundException.byName(name));
  }

  /**
   * スケジュールを検証してから保存する。次回実行時刻は現在時刻から再計算する。
   *
   * @throws InvalidScheduleException スケジュールが解釈できない場合
   * @throws JobNotFoundException ジョブが存在しない場合
   */
  public JobRecord updateJobSchedule(long id, String schedule, long intervalSeconds) {
    final JobRecord job = requireJob(id);
    final String normalized =
        ScheduleCalculator.isInterval(schedule) ? null : schedule.trim().replaceAll("\\s+", " ");
    final Instant now = clock.instant();
    final Instant nextRunAt = scheduleCalculator.computeNextRun(normalized, intervalSeconds, now);
    jobRepository.updateSchedule(id, normalized, intervalSeconds, nextRunAt, now);
    logger.info(
        "job schedule updated job={} schedule={} intervalSeconds={} nextRunAt={}",
        job.name(),
        normalized == null ? ScheduleCalculator.INTERVAL_MARKER : normalized,
        intervalSeconds,
        job.enabled() ? nextRunAt : null);
    return requireJob(id);
  }

  /** 有効化すると現在時刻から次回実行時刻を計算し、無効化すると消す。 */
  public JobRecord updateJobEnabled(long id, boolean enabled) {
    final JobRecord job = requireJob(id);
    final Instant now = clock.instant();
    final Instant nextRunAt =
        enabled
            ? scheduleCalculator.computeNextRun(job.schedule(), job.intervalSeconds(), now)
            : null;
    jobRepository.updateEnabled(id, enabled, nextRunAt, now);
    logger.info(
        "job enabled updated job={} enabled={} nextRunAt={}", job.name(), enabled, nextRunAt);
    return requireJob(id);
  }

  public RunNowResult runJobNow(String name) {
    getJob(name);
    return executionService.runNow(name);
  }

  /**
   * 期限が来たジョブを投入する。次回時刻が未設定の有効ジョブは runOnStart なら即実行、そうでなければ初期化する。
   *
   * <p>cron ジョブの保存済み次回時刻が現在のスケジュール (タイムゾーン変更や DB 直接編集後) から 60 秒を超えて
   * ずれていれば補正する。
   */
  public TickSummary tick() {
    final Instant now = clock.instant();
    final int corrected = correctDriftedCronRuns(now);
    int initialized = 0;
    int submitted = 0;
    int skipped = 0;
    for (JobRecord job : jobRepository.findEnabledWithoutNextRun()) {
      if (job.runOnStart()) {
        if (executionService.submit(job.name())) {
          submitted++;
        } else {
          skipped++;
        }
        continue;
      }
      try {
        final Instant nextRunAt =
            scheduleCalculator.computeNextRun(job.schedule(), job.intervalSeconds(), now);
        initialized += jobRepository.initializeNextRun(job.id(), nextRunAt, now);
      } catch (InvalidScheduleException ex) {
        logger.error(
            "cannot initialize next run job={} schedule={}", job.name(), job.schedule(), ex);
      }
    }
    final List<JobRecord> due = jobRepository.findDue(now);
    for (JobRecord job : due) {
      if (executionService.submit(job.name())) {
        submitted++;
      } else {
        skipped++;
      }
    }
    final TickSummary summary =
        new TickSummary(due.size(), submitted, skipped, initialized, corrected);
    logger.info(
        "scheduler tick due={} submitted={} skipped={} initialized={} corrected={} running={}",
        summary.due(),
        summary.submitted(),
        summary.skipped(),
        summary.initialized(),
        summary.corrected(),
        lockRegistry.runningCount());
    return summary;
  }

  private int correctDriftedCronRuns(Instant now) {
    int corrected = 0;
    for (JobRecord job : jobRepository.findUpcoming(now)) {
      // 固定間隔は前回完了時刻が基準なので補正しない
      if (ScheduleCalculator.isInterval(job.schedule())) {
        continue;
      }
      final Instant expected;
      try {
        expected = scheduleCalculator.computeNextRun(job.schedule(), job.intervalSeconds(), now);
      } catch (InvalidScheduleException ex) {
        logger.warn("cannot verify next run job={} schedule={}", job.name(), job.schedule());
        continue;
      }
      final Duration drift = Duration.between(job.nextRunAt(), expected).abs();
      if (drift.compareTo(NEXT_RUN_DRIFT_TOLERANCE) <= 0) {
        continue;
      }
      if (jobRepository.correctNextRun(job.id(), job.nextRunAt(), expected, now) > 0) {
        corrected++;
        logger.info(
            "next run corrected job={} stored={} expected={}",
            job.name(),
            job.nextRunAt(),
            expected);
      }
    }
    return corrected;
  }

  public List<JobRuntimeMetric> getJobRuntimeMetrics() {
    return runtimeMetrics.snapshot();
  }

  public List<String> getRunningJobNames() {
    return lockRegistry.snapshot();
  }

  /**
   * 実行履歴を新しい順に返す。
   *
   * @param jobName null なら全ジョブ
   */
  public JobHistoryPage listHistory(String jobName, int page, int size) {
    if (page < 0) {
      throw new IllegalArgumentException("page must be >= 0");
    }
    if (size < 1 || size > MAX_HISTORY_PAGE_SIZE) {
      throw new IllegalArgumentException("size must be between 1 and " + MAX_HISTORY_PAGE_SIZE);
    }
    final String filter = jobName == null || jobName.isBlank() ? null : jobName;
    final long offset = (long) page * size;
    final List<JobRunRecord> runs = historyRepository.findPage(filter, size, offset);
    return new JobHistoryPage(runs, page, size, historyRepository.count(filter));
  }

  public int clearHistory(String jobName) {
    final String filter = jobName == null || jobName.isBlank() ? null : jobName;
    final int deleted = historyRepository.deleteAll(filter);
    logger.info("job history cleared job={} deleted={}", filter == null ? "*" : filter, deleted);
    return deleted;
  }

  private JobRecord requireJob(long id) {
    return jobRepository.findById(id).orElseThrow(() -> JobNotFoundException.byId(id));
  }
}
