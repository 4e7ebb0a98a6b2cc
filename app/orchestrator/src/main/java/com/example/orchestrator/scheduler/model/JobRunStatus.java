/*
 * どこで: Scheduler ドメインモデル
 * 何を: ジョブ 1 回分の実行結果
 * なぜ: 履歴とメトリクスで同じ区分を使うため
 */
package com.example.orchestrator.scheduler.model;

public enum JobRunStatus {
  SUCCESS,
  FAILED
}
