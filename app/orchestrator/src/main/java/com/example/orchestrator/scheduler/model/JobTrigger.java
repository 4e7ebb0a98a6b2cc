/*
 * どこで: Scheduler ドメインモデル
 * 何を: 実行の起点 (tick か手動か)
 * なぜ: 履歴から手動実行を区別できるようにするため
 */
package com.example.orchestrator.scheduler.model;

public enum JobTrigger {
  SCHEDULE,
  MANUAL
}
