/*
 * どこで: Orchestrator 設定バインド
 * 何を: ジョブスケジューラの tick 間隔/タイムアウト/履歴保持を保持する
 * なぜ: 運用パラメータを環境ごとに外部化するため
 */
package com.example.orchestrator.config;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scheduler")
public record SchedulerProperties(
    boolean enabled,
    Duration tickInterval,
    Duration defaultJobTimeout,
    Map<String, Duration> jobTimeouts,
    int workerThreads,
    boolean notifyOnFailure,
    int historyRetentionDays,
    String zone) {

  public SchedulerProperties {
    tickInterval = tickInterval == null ? Duration.ofSeconds(60) : tickInterval;
    defaultJobTimeout = defaultJobTimeout == null ? Duration.ofMinutes(30) : defaultJobTimeout;
    jobTimeouts = jobTimeouts == null ? Map.of() : Map.copyOf(jobTimeouts);
    workerThreads = workerThreads <= 0 ? 4 : workerThreads;
    historyRetentionDays = historyRetentionDays <= 0 ? 30 : historyRetentionDays;
    zone = zone == null || zone.isBlank() ? "UTC" : zone;
  }

  public Duration timeoutFor(String jobName) {
    return jobTimeouts.getOrDefault(jobName, defaultJobTimeout);
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }
}
