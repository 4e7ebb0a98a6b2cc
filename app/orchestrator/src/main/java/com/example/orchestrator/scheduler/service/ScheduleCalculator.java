/*
 * どこで: Scheduler サービス層
 * 何を: 固定間隔または cron 式から次回実行時刻を計算する
 * なぜ: 保存前の検証と実行後の再計算で同じ規則を使うため
 */
package com.example.orchestrator.scheduler.service;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.example.orchestrator.config.SchedulerProperties;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * 次回実行時刻の計算器。
 *
 * <p>schedule が空または {@value #INTERVAL_MARKER} の場合は {@code from + intervalSeconds}。それ以外は
 * 5 フィールド (UNIX 形式) または 6 フィールド (先頭が秒の Spring 形式) の cron 式として設定タイムゾーンで
 * 評価し、{@code from} より厳密に後の最初の時刻を返す。解釈できない入力は {@link InvalidScheduleException}。
 */
@Component
public class ScheduleCalculator {

  public static final String INTERVAL_MARKER = "@interval";

  private static final CronParser UNIX_PARSER =
      new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
  private static final CronParser SPRING_PARSER =
      new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

  private final ZoneId zone;

  public ScheduleCalculator(SchedulerProperties properties) {
    this.zone = properties.zoneId();
  }

  public static boolean isInterval(String schedule) {
    return schedule == null
        || schedule.isBlank()
        || INTERVAL_MARKER.equalsIgnoreCase(schedule.trim());
  }

  public Instant computeNextRun(String schedule, long intervalSeconds, Instant from) {
    if (from == null) {
      throw new IllegalArgumentException("from is required");
    }
    if (isInterval(schedule)) {
      if (intervalSeconds <= 0) {
        throw new InvalidScheduleException("interval_seconds must be greater than 0");
      }
      return from.plusSeconds(intervalSeconds);
    }
    final ExecutionTime executionTime = ExecutionTime.forCron(parse(schedule));
    final ZonedDateTime base = from.atZone(zone);
    Optional<ZonedDateTime> next = executionTime.nextExecution(base);
    if (next.isPresent() && !next.get().toInstant().isAfter(from)) {
      // cron の最小粒度は秒なので 1 秒進めて再計算する
      next = executionTime.nextExecution(base.plusSeconds(1));
    }
    return next.map(ZonedDateTime::toInstant)
        .filter(candidate -> candidate.isAfter(from))
        .orElseThrow(
            () -> new InvalidScheduleException("schedule has no future execution: " + schedule));
  }

  private Cron parse(String schedule) {
    final String expression = schedule.trim().replaceAll("\\s+", " ");
    final int fields = expression.split(" ").length;
    final CronParser parser;
    if (fields == 5) {
      parser = UNIX_PARSER;
    } else if (fields == 6) {
      parser = SPRING_PARSER;
    } else {
      throw new InvalidScheduleException(
          "cron expression must have 5 or 6 fields: " + schedule);
    }
    try {
      final Cron cron = parser.parse(expression);
      cron.validate();
      return cron;
    } catch (IllegalArgumentException ex) {
      throw new InvalidScheduleException("invalid cron expression: " + schedule, ex);
    }
  }
}
