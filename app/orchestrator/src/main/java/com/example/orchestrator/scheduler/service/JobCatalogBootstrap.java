/*
 * どこで: Scheduler 起動処理
 * 何を: 登録済み JobHandler ごとに jobs 行を既定スケジュールで作成する
 * なぜ: コードにジョブを追加するだけで管理 API とスケジューラに現れるようにするため
 */
package com.example.orchestrator.scheduler.service;

import com.example.orchestrator.scheduler.handler.JobHandler;
import com.example.orchestrator.scheduler.model.JobRecord;
import com.example.orchestrator.scheduler.repository.JobRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JobCatalogBootstrap implements ApplicationRunner {

  private static final Logger logger = LoggerFactory.getLogger(JobCatalogBootstrap.class);

  private final JobHandlerRegistry handlerRegistry;
  private final JobRepository jobRepository;
  private final ScheduleCalculator scheduleCalculator;
  private final Clock clock;

  @Override
  public void run(ApplicationArguments args) {
    registerAll();
  }

  /** @return 新しく登録したジョブ数 */
  public int registerAll() {
    final Instant now = clock.instant();
    int inserted = 0;
    for (JobHandler handler : handlerRegistry.all()) {
      // 不正な既定スケジュールは起動時に失敗させる
      final Instant nextRunAt =
          handler.runOnStart()
              ? null
              : scheduleCalculator.computeNextRun(
                  handler.defaultSchedule(), handler.defaultIntervalSeconds(), now);
      final JobRecord record =
          new JobRecord(
              null,
              handler.name(),
              handler.description(),
              handler.defaultSchedule(),
              handler.defaultIntervalSeconds(),
              true,
              handler.runOnStart(),
              null,
              nextRunAt,
              0,
              null,
              now,
              now);
      if (jobRepository.insertIfAbsent(record)) {
        inserted++;
        logger.info("job registered job={} nextRunAt={}", handler.name(), nextRunAt);
      }
    }
    logger.info(
        "job catalog ready handlers={} inserted={}", handlerRegistry.all().size(), inserted);
    return inserted;
  }
}
