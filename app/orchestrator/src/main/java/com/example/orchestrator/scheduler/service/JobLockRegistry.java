/*
 * どこで: Scheduler サービス層
 * 何を: ジョブ名単位の実行中フラグを管理する
 * なぜ: tick と手動実行が同じジョブを同時に走らせないようにするため
 */
package com.example.orchestrator.scheduler.service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

@Component
public class JobLockRegistry {

  private final Set<String> running = ConcurrentHashMap.newKeySet();

  /** 未実行なら実行中に登録して true。既に実行中なら false。 */
  public boolean tryAcquire(String jobName) {
    return running.add(jobName);
  }

  public void release(String jobName) {
    running.remove(jobName);
  }

  public boolean isRunning(String jobName) {
    return running.contains(jobName);
  }

  public int runningCount() {
    return running.size();
  }

  public List<String> snapshot() {
    return running.stream().sorted().toList();
  }
}
