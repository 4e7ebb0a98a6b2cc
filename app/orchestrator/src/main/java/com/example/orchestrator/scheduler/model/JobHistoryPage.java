/*
 * どこで: Scheduler ドメインモデル
 * 何を: 実行履歴の 1 ページ分
 * なぜ: 件数と合わせてページングを API へ返すため
 */
package com.example.orchestrator.scheduler.model;

import java.util.List;

public record JobHistoryPage(List<JobRunRecord> runs, int page, int size, long total) {

  public JobHistoryPage {
    runs = runs == null ? List.of() : List.copyOf(runs);
  }
}
