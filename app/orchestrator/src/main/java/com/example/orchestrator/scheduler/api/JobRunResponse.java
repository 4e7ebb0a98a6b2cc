/*
 * どこで: Scheduler 管理 API
 * 何を: 実行履歴 1 件のレスポンス
 * なぜ: 手動実行の結果と履歴一覧で同じ形式を返すため
 */
package com.example.orchestrator.scheduler.api;

import com.example.orchestrator.scheduler.model.JobRunRecord;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobRunResponse(
    Long id,
    String jobName,
    String trigger,
    String status,
    Instant startedAt,
    Instant finishedAt,
    long durationMs,
    String errorMessage,
    String details) {

  public static JobRunResponse from(JobRunRecord run) {
    return new JobRunResponse(
        run.id(),
        run.jobName(),
        run.trigger().name(),
        run.status().name(),
        run.startedAt(),
        run.finishedAt(),
        run.durationMs(),
        run.errorMessage(),
        run.details());
  }
}
