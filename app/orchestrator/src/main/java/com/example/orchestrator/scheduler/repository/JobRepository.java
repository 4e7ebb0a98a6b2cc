/*
 * どこで: Scheduler データアクセス
 * 何を: jobs テーブルの登録/取得/スケジュール更新を担う
 * なぜ: tick ループと管理 API が同じジョブ定義を参照するため
 */
package com.example.orchestrator.scheduler.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.orchestrator.scheduler.model.JobRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT id, name, description, schedule, interval_seconds, enabled, run_on_start,
             last_run_at, next_run_at, failure_count, last_error, created_at, updated_at
      FROM jobs
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** 同名ジョブが既にあれば何もしない。運用で変更したスケジュールを起動時に上書きしないため。 */
  public boolean insertIfAbsent(JobRecord record) {
    final String sql =
        """
        INSERT INTO jobs (
          name, description, schedule, interval_seconds, enabled, run_on_start,
          next_run_at, failure_count, created_at, updated_at
        ) VALUES (
          :name, :description, :schedule, :intervalSeconds, :enabled, :runOnStart,
          :nextRunAt, 0, :createdAt, :updatedAt
        )
        ON CONFLICT (name) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", record.name())
            .addValue("description", record.description())
            .addValue("schedule", record.schedule())
            .addValue("intervalSeconds", record.intervalSeconds())
            .addValue("enabled", record.enabled())
            .addValue("runOnStart", record.runOnStart())
            .addValue("nextRunAt", toTimestamp(record.nextRunAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public List<JobRecord> findAll() {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " ORDER BY name", new MapSqlParameterSource(), this::mapRow);
  }

  public Optional<JobRecord> findByName(String name) {
    final List<JobRecord> records =
        jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE name = :name",
            new MapSqlParameterSource().addValue("name", name),
            this::mapRow);
    return records.stream().findFirst();
  }

  public Optional<JobRecord> findById(long id) {
    final List<JobRecord> records =
        jdbcTemplate.query(
            SELECT_COLUMNS + " WHERE id = :id",
            new MapSqlParameterSource().addValue("id", id),
            this::mapRow);
    return records.stream().findFirst();
  }

  /** 有効で next_run_at が now 以前のジョブ。 */
  public List<JobRecord> findDue(Instant now) {
    final String sql =
        SELECT_COLUMNS
            + """
             WHERE enabled
               AND next_run_at IS NOT NULL
               AND next_run_at <= :now
             ORDER BY next_run_at, name
            """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)), this::mapRow);
  }

  /** 有効なのに next_run_at が未設定のジョブ (新規登録直後や再起動直後)。 */
  public List<JobRecord> findEnabledWithoutNextRun() {
    final String sql = SELECT_COLUMNS + " WHERE enabled AND next_run_at IS NULL ORDER BY name";
    return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
  }

  /** 有効で次回時刻がまだ先のジョブ。tick での次回時刻補正に使う。 */
  public List<JobRecord> findUpcoming(Instant now) {
    final String sql =
        SELECT_COLUMNS
            + """
             WHERE enabled
               AND next_run_at > :now
             ORDER BY name
            """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)), this::mapRow);
  }

  /** 読み取り時の next_run_at のままなら補正値で置き換える。実行完了と競合した場合は 0 件。 */
  public int correctNextRun(long id, Instant storedNextRunAt, Instant nextRunAt, Instant now) {
    final String sql =
        """
        UPDATE jobs
        SET next_run_at = :nextRunAt,
            updated_at = :now
        WHERE id = :id
          AND enabled
          AND next_run_at = :storedNextRunAt
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("storedNextRunAt", toTimestamp(storedNextRunAt))
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int initializeNextRun(long id, Instant nextRunAt, Instant now) {
    final String sql =
        """
        UPDATE jobs
        SET next_run_at = :nextRunAt,
            updated_at = :now
        WHERE id = :id
          AND enabled
          AND next_run_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int updateSchedule(
      long id, String schedule, long intervalSeconds, Instant nextRunAt, Instant now) {
    // 無効化中のジョブには next_run_at を入れない
    final String sql =
        """
        UPDATE jobs
        SET schedule = :schedule,
            interval_seconds = :intervalSeconds,
            next_run_at = CASE WHEN enabled THEN :nextRunAt ELSE NULL END,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("schedule", schedule)
            .addValue("intervalSeconds", intervalSeconds)
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int updateEnabled(long id, boolean enabled, Instant nextRunAt, Instant now) {
    final String sql =
        """
        UPDATE jobs
        SET enabled = :enabled,
            next_run_at = :nextRunAt,
            updated_at = :now
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("enabled", enabled)
            .addValue("nextRunAt", enabled ? toTimestamp(nextRunAt) : null)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * 実行完了を記録する。完了までに無効化されていれば next_run_at は NULL のまま残す。
   */
  public int recordCompletion(
      String name, Instant lastRunAt, Instant nextRunAt, boolean success, String lastError) {
    final String sql =
        """
        UPDATE jobs
        SET last_run_at = :lastRunAt,
            next_run_at = CASE WHEN enabled THEN :nextRunAt ELSE NULL END,
            failure_count = CASE WHEN :success THEN 0 ELSE failure_count + 1 END,
            last_error = :lastError,
            updated_at = :lastRunAt
        WHERE name = :name
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("name", name)
            .addValue("lastRunAt", toTimestamp(lastRunAt))
            .addValue("nextRunAt", toTimestamp(nextRunAt))
            .addValue("success", success)
            .addValue("lastError", success ? null : lastError);
    return jdbcTemplate.update(sql, params);
  }

  private JobRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new JobRecord(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("description"),
        rs.getString("schedule"),
        rs.getLong("interval_seconds"),
        rs.getBoolean("enabled"),
        rs.getBoolean("run_on_start"),
        toInstant(rs.getTimestamp("last_run_at")),
        toInstant(rs.getTimestamp("next_run_at")),
        rs.getInt("failure_count"),
        rs.getString("last_error"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
