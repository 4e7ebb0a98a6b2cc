/*
 * どこで: Scheduler 管理 API
 * 何を: ジョブ一覧/スケジュール変更/有効化/手動実行/統計/履歴のエンドポイントを提供する
 * なぜ: 管理画面からバックグラウンド処理を操作できるようにするため
 */
package com.example.orchestrator.scheduler.api;

import com.example.orchestrator.api.ApiErrorCode;
import com.example.orchestrator.api.ApiErrorResponse;
import com.example.orchestrator.scheduler.model.JobRecord;
import com.example.orchestrator.scheduler.model.RunNowResult;
import com.example.orchestrator.scheduler.service.JobSchedulerService;
import jakarta.validation.Valid;
import java.util.HashSet;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/v1/admin/jobs")
@RequiredArgsConstructor
public class JobAdminController {

  private final JobSchedulerService schedulerService;

  @GetMapping
  public JobsResponse list() {
    final Set<String> running = new HashSet<>(schedulerService.getRunningJobNames());
    return new JobsResponse(
        schedulerService.listJobs().stream()
            .map(job -> JobResponse.from(job, running.contains(job.name())))
            .toList());
  }

  @GetMapping("/metrics")
  public JobRuntimeMetricsResponse metrics() {
    return new JobRuntimeMetricsResponse(schedulerService.getJobRuntimeMetrics());
  }

  @GetMapping("/running")
  public RunningJobsResponse running() {
    return new RunningJobsResponse(schedulerService.getRunningJobNames());
  }

  @GetMapping("/history")
  public JobHistoryResponse history(
      @RequestParam(name = "job_name", required = false) String jobName,
      @RequestParam(name = "page", defaultValue = "0") int page,
      @RequestParam(name = "size", defaultValue = "50") int size) {
    return JobHistoryResponse.from(schedulerService.listHistory(jobName, page, size));
  }

  @DeleteMapping("/history")
  public ClearHistoryResponse clearHistory(
      @RequestParam(name = "job_name", required = false) String jobName) {
    return new ClearHistoryResponse(schedulerService.clearHistory(jobName));
  }

  @GetMapping("/{name}")
  public JobResponse get(@PathVariable("name") String name) {
    return toResponse(schedulerService.getJob(name));
  }

  @PutMapping("/{id}/schedule")
  public JobResponse updateSchedule(
      @PathVariable("id") long id, @Valid @RequestBody JobScheduleRequest request) {
    return toResponse(
        schedulerService.updateJobSchedule(id, request.schedule(), request.intervalOrZero()));
  }

  @PutMapping("/{id}/enabled")
  public JobResponse updateEnabled(
      @PathVariable("id") long id, @Valid @RequestBody JobEnabledRequest request) {
    return toResponse(schedulerService.updateJobEnabled(id, request.enabled()));
  }

  @PostMapping("/{name}/run")
  public ResponseEntity<?> run(@PathVariable("name") String name) {
    final RunNowResult result = schedulerService.runJobNow(name);
    return switch (result.outcome()) {
      case COMPLETED -> ResponseEntity.ok(JobRunResponse.from(result.run()));
      case ALREADY_RUNNING ->
          ResponseEntity.status(HttpStatus.CONFLICT)
              .body(
                  new ApiErrorResponse(
                      ApiErrorCode.JOB_ALREADY_RUNNING, "job is already running: " + name));
      case NO_HANDLER ->
          ResponseEntity.status(HttpStatus.CONFLICT)
              .body(
                  new ApiErrorResponse(
                      ApiErrorCode.JOB_HANDLER_MISSING, "no handler registered for job: " + name));
    };
  }

  private JobResponse toResponse(JobRecord job) {
    return JobResponse.from(job, schedulerService.getRunningJobNames().contains(job.name()));
  }
}
