/*
 * どこで: Scheduler 管理 API
 * 何を: スケジュール変更リクエスト
 * なぜ: cron 式と固定間隔のどちらでも受け付けるため
 */
package com.example.orchestrator.scheduler.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.PositiveOrZero;

/** schedule が空または "@interval" なら intervalSeconds を使う。 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record JobScheduleRequest(String schedule, @PositiveOrZero Long intervalSeconds) {

  public long intervalOrZero() {
    return intervalSeconds == null ? 0L : intervalSeconds;
  }
}
