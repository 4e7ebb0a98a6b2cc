/*
 * どこで: Scheduler ドメインモデル
 * 何を: 1 回の tick で行った処理件数
 * なぜ: ハートビートログとテストで tick の結果を確認するため
 */
package com.example.orchestrator.scheduler.model;

public record TickSummary(int due, int submitted, int skipped, int initialized, int corrected) {}
