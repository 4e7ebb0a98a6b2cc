package com.example.orchestrator.scheduler.api;

import com.example.orchestrator.scheduler.model.JobRuntimeMetric;
import java.util.List;

public record JobRuntimeMetricsResponse(List<JobRuntimeMetric> metrics) {

  public JobRuntimeMetricsResponse {
    metrics = metrics == null ? List.of() : List.copyOf(metrics);
  }
}
