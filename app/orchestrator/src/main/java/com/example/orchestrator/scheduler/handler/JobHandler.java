/*
 * どこで: Scheduler ジョブ SPI
 * 何を: スケジューラから呼び出される 1 種類のバックグラウンド処理
 * なぜ: ジョブ本体とスケジューリング/履歴管理を分離するため
 */
package com.example.orchestrator.scheduler.handler;

/**
 * ジョブ本体。Bean として登録すると起動時に jobs テーブルへ既定スケジュールで登録される。
 *
 * <p>実行はタイムアウト時に割り込まれるため、長い処理は割り込みフラグを確認すること。
 */
public interface JobHandler {

  /** jobs.name と一致する一意な名前。 */
  String name();

  default String description() {
    return "";
  }

  /** null なら {@link #defaultIntervalSeconds()} による固定間隔。 */
  default String defaultSchedule() {
    return null;
  }

  default long defaultIntervalSeconds() {
    return 3600;
  }

  default boolean runOnStart() {
    return false;
  }

  /**
   * 処理を実行し、履歴に残す要約を返す。
   *
   * @throws Exception 失敗した場合。メッセージは履歴と通知に記録される
   */
  String run() throws Exception;
}
