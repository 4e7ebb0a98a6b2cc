/*
 * どこで: Scheduler サービス層
 * 何を: ジョブ実行時間/実行中件数/スキップ件数を Micrometer に記録する
 * なぜ: ジョブの遅延や詰まりを Prometheus から観測できるようにするため
 */
package com.example.orchestrator.scheduler.service;

import com.example.orchestrator.scheduler.model.JobRunStatus;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
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
public class JobMetrics {

  static final String METRIC_JOB_DURATION = "scheduler.job.duration";
  static final String METRIC_JOB_SKIPPED = "scheduler.job.skipped.total";
  static final String METRIC_JOBS_RUNNING = "scheduler.jobs.running";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Timer> durationTimers = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> skippedCounters = new ConcurrentHashMap<>();

  public JobMetrics(MeterRegistry meterRegistry, JobLockRegistry lockRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_JOBS_RUNNING, lockRegistry, JobLockRegistry::runningCount)
        .description("Number of jobs currently running")
        .register(meterRegistry);
  }

  public void recordRun(String jobName, JobRunStatus status, Duration duration) {
    final String result = status.name().toLowerCase(Locale.ROOT);
    durationTimers
        .computeIfAbsent(
            jobName + ":" + result,
            ignored ->
                Timer.builder(METRIC_JOB_DURATION)
                    .description("Job execution duration")
                    .tags(Tags.of("job", jobName, "result", result))
                    .register(meterRegistry))
        .record(duration);
  }

  public void recordSkipped(String jobName) {
    skippedCounters
        .computeIfAbsent(
            jobName,
            ignored ->
                Counter.builder(METRIC_JOB_SKIPPED)
                    .description("Job runs skipped because the job was already running")
                    .tags(Tags.of("job", jobName))
                    .register(meterRegistry))
        .increment();
  }
}
