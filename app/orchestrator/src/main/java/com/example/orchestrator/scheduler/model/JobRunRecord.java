/*
 * どこで: Scheduler ドメインモデル
 * 何を: job_history テーブルの 1 行 (不変の実行記録)
 * なぜ: 実行結果を追記専用で残し、後から監査できるようにするため
 */
package com.example.orchestrator.scheduler.model;

import java.time.Instant;

public record JobRunRecord(
    Long id,
    String jobName,
    JobTrigger trigger,
    JobRunStatus status,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    String errorMessage,
    String details) {

  public JobRunRecord withId(long newId) {
    return new JobRunRecord(
        newId, jobName, trigger, status, startedAt, finishedAt, durationMs, errorMessage, details);
  }
}
