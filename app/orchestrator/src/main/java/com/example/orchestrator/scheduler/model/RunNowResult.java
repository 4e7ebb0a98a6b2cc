/*
 * どこで: Scheduler ドメインモデル
 * 何を: 手動実行の結果 (実行できたか、できなかった理由)
 * なぜ: 実行中による拒否を例外ではなく値で返すため
 */
package com.example.orchestrator.scheduler.model;

public record RunNowResult(Outcome outcome, JobRunRecord run) {

  public enum Outcome {
    COMPLETED,
    ALREADY_RUNNING,
    NO_HANDLER
  }

  public static RunNowResult completed(JobRunRecord run) {
    return new RunNowResult(Outcome.COMPLETED, run);
  }

  public static RunNowResult alreadyRunning() {
    return new RunNowResult(Outcome.ALREADY_RUNNING, null);
  }

  public static RunNowResult noHandler() {
    return new RunNowResult(Outcome.NO_HANDLER, null);
  }
}
