package com.example.orchestrator.scheduler.api;

import java.util.List;

public record RunningJobsResponse(List<String> jobs) {

  public RunningJobsResponse {
    jobs = jobs == null ? List.of() : List.copyOf(jobs);
  }
}
