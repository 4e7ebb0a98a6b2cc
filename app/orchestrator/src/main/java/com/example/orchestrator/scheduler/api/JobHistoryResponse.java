package com.example.orchestrator.scheduler.api;

import com.example.orchestrator.scheduler.model.JobHistoryPage;
import java.util.List;

public record JobHistoryResponse(List<JobRunResponse> runs, int page, int size, long total) {

  public JobHistoryResponse {
    runs = runs == null ? List.of() : List.copyOf(runs);
  }

  public static JobHistoryResponse from(JobHistoryPage page) {
    return new JobHistoryResponse(
        page.runs().stream().map(JobRunResponse::from).toList(),
        page.page(),
        page.size(),
        page.total());
  }
}
