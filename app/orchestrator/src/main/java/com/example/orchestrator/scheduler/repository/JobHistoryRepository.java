/*
 * どこで: Scheduler データアクセス
 * 何を: job_history テーブルへの追記/ページング取得/削除を担う
 * なぜ: 実行記録を不変の履歴として残し、保持期間で掃除するため
 */
package com.example.orchestrator.scheduler.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.orchestrator.scheduler.model.JobRunRecord;
import com.example.orchestrator.scheduler.model.JobRunStatus;
import com.example.orchestrator.scheduler.model.JobTrigger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobHistoryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public long insert(JobRunRecord record) {
    final String sql =
        """
        INSERT INTO job_history (
          job_name, trigger_type, status, started_at, finished_at,
          duration_ms, error_message, details
        ) VALUES (
          :jobName, :trigger, :status, :startedAt, :finishedAt,
          :durationMs, :errorMessage, :details
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobName", record.jobName())
            .addValue("trigger", record.trigger().name())
            .addValue("status", record.status().name())
            .addValue("startedAt", toTimestamp(record.startedAt()))
            .addValue("finishedAt", toTimestamp(record.finishedAt()))
            .addValue("durationMs", record.durationMs())
            .addValue("errorMessage", record.errorMessage())
            .addValue("details", record.details());
    final KeyHolder keyHolder = new GeneratedKeyHolder();
    jdbcTemplate.update(sql, params, keyHolder, new String[] {"id"});
    final Number key = keyHolder.getKey();
    if (key == null) {
      throw new IllegalStateException("job history id was not generated");
    }
    return key.longValue();
  }

  /** 新しい順に返す。jobName が null なら全ジョブ。 */
  public List<JobRunRecord> findPage(String jobName, int limit, long offset) {
    final StringBuilder sql =
        new StringBuilder(
            """
            SELECT id, job_name, trigger_type, status, started_at, finished_at, duration_ms,
                   error_message, details
            FROM job_history
            """);
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("limit", limit).addValue("offset", offset);
    if (jobName != null) {
      sql.append(" WHERE job_name = :jobName");
      params.addValue("jobName", jobName);
    }
    sql.append(" ORDER BY started_at DESC, id DESC LIMIT :limit OFFSET :offset");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public long count(String jobName) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    String sql = "SELECT COUNT(*) FROM job_history";
    if (jobName != null) {
      sql += " WHERE job_name = :jobName";
      params.addValue("jobName", jobName);
    }
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  public int deleteAll(String jobName) {
    if (jobName == null) {
      return jdbcTemplate.update("DELETE FROM job_history", new MapSqlParameterSource());
    }
    return jdbcTemplate.update(
        "DELETE FROM job_history WHERE job_name = :jobName",
        new MapSqlParameterSource().addValue("jobName", jobName));
  }

  public int deleteStartedBefore(Instant threshold) {
    final String sql =
        """
        DELETE FROM job_history
        WHERE started_at < :threshold
        """;
    return jdbcTemplate.update(
        sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  private JobRunRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new JobRunRecord(
        rs.getLong("id"),
        rs.getString("job_name"),
        JobTrigger.valueOf(rs.getString("trigger_type")),
        JobRunStatus.valueOf(rs.getString("status")),
        toInstant(rs.getTimestamp("started_at")),
        toInstant(rs.getTimestamp("finished_at")),
        rs.getLong("duration_ms"),
        rs.getString("error_message"),
        rs.getString("details"));
  }
}
