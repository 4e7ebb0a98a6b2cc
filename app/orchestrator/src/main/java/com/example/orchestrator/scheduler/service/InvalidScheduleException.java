/*
 * どこで: Scheduler サービス層
 * 何を: cron 式や実行間隔が解釈できないことを表す
 * なぜ: 不正なスケジュールを黙って既定値へ置き換えず、呼び出し元へ明示するため
 */
package com.example.orchestrator.scheduler.service;

public class InvalidScheduleException extends RuntimeException {

  public InvalidScheduleException(String message) {
    super(message);
  }

  public InvalidScheduleException(String message, Throwable cause) {
    super(message, cause);
  }
}
