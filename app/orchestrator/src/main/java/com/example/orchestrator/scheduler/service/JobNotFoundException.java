/*
 * どこで: Scheduler サービス層
 * 何を: 指定のジョブが存在しないことを表す
 * なぜ: API 層で 404 へ一貫変換するため
 */
package com.example.orchestrator.scheduler.service;

public class JobNotFoundException extends RuntimeException {

  public JobNotFoundException(String message) {
    super(message);
  }

  public static JobNotFoundException byName(String name) {
    return new JobNotFoundException("job not found: " + name);
  }

  public static JobNotFoundException byId(long id) {
    return new JobNotFoundException("job not found: id=" + id);
  }
}
