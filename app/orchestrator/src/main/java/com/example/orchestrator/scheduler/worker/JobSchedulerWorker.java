/*
 * どこで: Scheduler ワーカー
 * 何を: 一定間隔で tick を呼び、期限が来たジョブを投入する
 * なぜ: DB 上の next_run_at を基準にジョブを自動実行するため
 */
package com.example.orchestrator.scheduler.worker;

import com.example.orchestrator.scheduler.service.JobSchedulerService;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class JobSchedulerWorker {

  private static final Logger logger = LoggerFactory.getLogger(JobSchedulerWorker.class);

  private final JobSchedulerService schedulerService;

  @Scheduled(
      fixedDelayString = "${scheduler.tick-interval:60s}",
      initialDelayString = "${scheduler.initial-delay:5s}")
  public void run() {
    try {
      schedulerService.tick();
    } catch (DataAccessException ex) {
      // DB 障害時は次の tick で再試行する
      logger.error("scheduler tick failed", ex);
    }
  }
}
