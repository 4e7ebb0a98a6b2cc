package com.example.orchestrator.scheduler.api;

import java.util.List;

public record JobsResponse(List<JobResponse> jobs) {

  public JobsResponse {
    jobs = jobs == null ? List.of() : List.copyOf(jobs);
  }
}
