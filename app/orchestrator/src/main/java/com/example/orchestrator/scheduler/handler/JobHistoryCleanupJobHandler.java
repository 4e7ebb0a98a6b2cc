/*
 * どこで: Scheduler 組み込みジョブ
 * 何を: 保持期間を過ぎた実行履歴を削除する
 * なぜ: job_history が無制限に増えないようにするため
 */
package com.example.orchestrator.scheduler.handler;

import com.example.orchestrator.config.SchedulerProperties;
import com.example.orchestrator.scheduler.repository.JobHistoryRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JobHistoryCleanupJobHandler implements JobHandler {

  public static final String NAME = "job-history-cleanup";

  private final JobHistoryRepository historyRepository;
  private final SchedulerProperties properties;
  private final Clock clock;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String description() {
    return "Deletes job history older than the retention period";
  }

  @Override
  public String defaultSchedule() {
    return "0 3 * * *";
  }

  @Override
  public String run() {
    final Instant threshold =
        clock.instant().minus(Duration.ofDays(properties.historyRetentionDays()));
    final int deleted = historyRepository.deleteStartedBefore(threshold);
    return "deleted " + deleted + " runs started before " + threshold;
  }
}
