/*
 * どこで: Scheduler ドメインモデル
 * 何を: jobs テーブルの 1 行 (ジョブ定義と直近の実行状態)
 * なぜ: リポジトリとサービス間で型付きで受け渡すため
 */
package com.example.orchestrator.scheduler.model;

import java.time.Instant;

public record JobRecord(
    Long id,
    String name,
    String description,
    String schedule,
    long intervalSeconds,
    boolean enabled,
    boolean runOnStart,
    Instant lastRunAt,
    Instant nextRunAt,
    int failureCount,
    String lastError,
    Instant createdAt,
    Instant updatedAt) {

  public boolean isDue(Instant now) {
    return enabled && nextRunAt != null && !nextRunAt.isAfter(now);
  }
}
