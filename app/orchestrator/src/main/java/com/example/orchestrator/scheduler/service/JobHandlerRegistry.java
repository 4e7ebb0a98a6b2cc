/*
 * どこで: Scheduler サービス層
 * 何を: ジョブ名から JobHandler を解決する
 * なぜ: DB 上のジョブ定義とコード上の処理を名前で結び付けるため
 */
package com.example.orchestrator.scheduler.service;

import com.example.orchestrator.scheduler.handler.JobHandler;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.springframework.stereotype.Component;

@Component
public class JobHandlerRegistry {

  private final Map<String, JobHandler> handlers = new TreeMap<>();

  public JobHandlerRegistry(List<JobHandler> handlers) {
    for (JobHandler handler : handlers) {
      final JobHandler previous = this.handlers.put(handler.name(), handler);
      if (previous != null) {
        throw new IllegalStateException("duplicate job handler: " + handler.name());
      }
    }
  }

  public Optional<JobHandler> find(String name) {
    return Optional.ofNullable(handlers.get(name));
  }

  public Collection<JobHandler> all() {
    return List.copyOf(handlers.values());
  }
}
