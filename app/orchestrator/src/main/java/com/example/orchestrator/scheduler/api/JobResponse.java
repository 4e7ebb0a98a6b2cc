/*
 * どこで: Scheduler 管理 API
 * 何を: ジョブ定義 1 件と実行状態のレスポンス
 * なぜ: 管理画面に次回実行時刻や実行中フラグを表示するため
 */
package com.example.orchestrator.scheduler.api;

import com.example.orchestrator.scheduler.model.JobRecord;
import com.example.orchestrator.scheduler.service.ScheduleCalculator;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobResponse(
    long id,
    String name,
    String description,
    String schedule,
    long intervalSeconds,
    boolean enabled,
    boolean running,
    Instant lastRunAt,
    Instant nextRunAt,
    int failureCount,
    String lastError) {

  public static JobResponse from(JobRecord job, boolean running) {
    return new JobResponse(
        job.id(),
        job.name(),
        job.description(),
        ScheduleCalculator.isInterval(job.schedule())
            ? ScheduleCalculator.INTERVAL_MARKER
            : job.schedule(),
        job.intervalSeconds(),
        job.enabled(),
        running,
        job.lastRunAt(),
        job.nextRunAt(),
        job.failureCount(),
        job.lastError());
  }
}
