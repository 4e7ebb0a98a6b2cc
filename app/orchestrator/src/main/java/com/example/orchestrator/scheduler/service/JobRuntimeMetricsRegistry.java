/*
 * どこで: Scheduler サービス層
 * 何を: ジョブ名ごとの実行統計をメモリ上で集計する
 * なぜ: 管理画面が DB を集計せずに成功率や平均時間を表示できるようにするため
 */
package com.example.orchestrator.scheduler.service;

import com.example.orchestrator.scheduler.model.JobRunRecord;
import com.example.orchestrator.scheduler.model.JobRuntimeMetric;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
public class JobRuntimeMetricsRegistry {

  private final ConcurrentMap<String, JobRuntimeMetric> metrics = new ConcurrentHashMap<>();

  public JobRuntimeMetric record(JobRunRecord run) {
    return metrics.compute(
        run.jobName(),
        (name, current) -> (current == null ? JobRuntimeMetric.empty(name) : current).record(run));
  }

  public Optional<JobRuntimeMetric> find(String jobName) {
    return Optional.ofNullable(metrics.get(jobName));
  }

  public List<JobRuntimeMetric> snapshot() {
    return metrics.values().stream()
        .sorted((left, right) -> left.jobName().compareTo(right.jobName()))
        .toList();
  }
}
