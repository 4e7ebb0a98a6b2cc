/*
 * どこで: Scheduler ドメインモデル
 * 何を: ジョブ名ごとのプロセス内実行統計 (不変スナップショット)
 * なぜ: 読み取り側がロックなしで一貫した値を得られるようにするため
 */
package com.example.orchestrator.scheduler.model;

import java.time.Instant;

public record JobRuntimeMetric(
    String jobName,
    long totalRuns,
    long successRuns,
    long failedRuns,
    double avgDurationMs,
    double successRate,
    double failureRate,
    long lastDurationMs,
    Instant lastStartedAt,
    Instant lastFinishedAt,
    LastResult lastResult,
    String lastError) {

  public enum LastResult {
    NONE,
    SUCCESS,
    FAILURE
  }

  public static JobRuntimeMetric empty(String jobName) {
    return new JobRuntimeMetric(
        jobName, 0, 0, 0, 0.0, 0.0, 0.0, 0, null, null, LastResult.NONE, null);
  }

  /** 1 回分の結果を取り込んだ新しいスナップショットを返す。平均は累積平均。 */
  public JobRuntimeMetric record(JobRunRecord run) {
    final long total = totalRuns + 1;
    final boolean success = run.status() == JobRunStatus.SUCCESS;
    final long successes = successRuns + (success ? 1 : 0);
    final long failures = failedRuns + (success ? 0 : 1);
    final double average = avgDurationMs + (run.durationMs() - avgDurationMs) / total;
    return new JobRuntimeMetric(
        jobName,
        total,
        successes,
        failures,
        average,
        (double) successes / total,
        (double) failures / total,
        run.durationMs(),
        run.startedAt(),
        run.finishedAt(),
        success ? LastResult.SUCCESS : LastResult.FAILURE,
        success ? lastError : run.errorMessage());
  }
}
