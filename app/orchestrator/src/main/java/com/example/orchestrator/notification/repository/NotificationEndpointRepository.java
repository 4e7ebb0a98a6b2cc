/*
 * どこで: Notification データアクセス
 * 何を: notification_endpoints と user_notification_endpoints の登録/取得/更新を担う
 * なぜ: ディスパッチ時の対象抽出と管理 API の CRUD を支えるため
 */
package com.example.orchestrator.notification.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.orchestrator.notification.model.DispatchScope;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.example.orchestrator.notification.model.NotificationEndpointRecord;
import com.example.orchestrator.notification.model.NotificationEventType;
import com.example.orchestrator.notification.model.NotificationTypeMask;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

@Repository
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JdbcTemplate と ObjectMapper は Spring 管理の共有コンポーネントのため")
public class NotificationEndpointRepository {

  private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<>() {};

  private static final String SELECT_COLUMNS =
      """
      SELECT e.id, e.name, e.type, e.enabled, e.is_global, e.event_mask,
             e.config::text AS config_text, e.created_at, e.updated_at
      FROM notification_endpoints e
      """;

  // ビット 0 (全カテゴリ) か、イベントのビットが立っているものを対象にする
  private static final String MASK_MATCH =
      "((e.event_mask & 1) <> 0 OR (e.event_mask & :eventBit) = :eventBit)";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public NotificationEndpointRepository(
      NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  public long insert(NotificationEndpointRecord record) {
    final String sql =
        """
        INSERT INTO notification_endpoints (
          name, type, enabled, is_global, event_mask, config, created_at, updated_at
        ) VALUES (
          :name, :type, :enabled, :global, :eventMask, :config::jsonb, :createdAt, :updatedAt
        )
        """;
    final KeyHolder keyHolder = new GeneratedKeyHolder();
    jdbcTemplate.update(sql, params(record), keyHolder, new String[] {"id"});
    final Number key = keyHolder.getKey();
    if (key == null) {
      throw new IllegalStateException("notification endpoint id was not generated");
    }
    return key.longValue();
  }

  public int update(NotificationEndpointRecord record) {
    final String sql =
        """
        UPDATE notification_endpoints
        SET name = :name,
            type = :type,
            enabled = :enabled,
            is_global = :global,
            event_mask = :eventMask,
            config = :config::jsonb,
            updated_at = :updatedAt
        WHERE id = :id
        """;
    return jdbcTemplate.update(sql, params(record));
  }

  public int updateEnabled(long id, boolean enabled, Instant updatedAt) {
    final String sql =
        """
        UPDATE notification_endpoints
        SET enabled = :enabled,
            updated_at = :updatedAt
        WHERE id = :id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("enabled", enabled)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  public int delete(long id) {
    final String sql = "DELETE FROM notification_endpoints WHERE id = :id";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("id", id));
  }

  public Optional<NotificationEndpointRecord> findById(long id) {
    final String sql = SELECT_COLUMNS + " WHERE e.id = :id";
    final List<NotificationEndpointRecord> records =
        jdbcTemplate.query(sql, new MapSqlParameterSource().addValue("id", id), this::mapRow);
    return records.stream().findFirst();
  }

  public List<NotificationEndpointRecord> findAll() {
    return jdbcTemplate.query(
        SELECT_COLUMNS + " ORDER BY e.id", new MapSqlParameterSource(), this::mapRow);
  }

  /**
   * 有効かつマスクが一致するエンドポイントを宛先範囲で絞り込んで返す。
   */
  public List<NotificationEndpointRecord> findDispatchTargets(
      NotificationEventType eventType, DispatchScope scope) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("eventBit", eventType.mask());
    final StringBuilder sql =
        new StringBuilder(SELECT_COLUMNS).append(" WHERE e.enabled AND ").append(MASK_MATCH);
    switch (scope.kind()) {
      case ALL -> {
        // 絞り込みなし
      }
      case USERS -> {
        if (scope.userIds().isEmpty()) {
          return List.of();
        }
        sql.append(" AND e.id IN (").append(assignedEndpointsSubquery()).append(')');
        params.addValue("userIds", scope.userIds());
      }
      case USERS_AND_GLOBAL -> {
        if (scope.userIds().isEmpty()) {
          sql.append(" AND e.is_global");
        } else {
          sql.append(" AND (e.is_global OR e.id IN (")
              .append(assignedEndpointsSubquery())
              .append("))");
          params.addValue("userIds", scope.userIds());
        }
      }
    }
    sql.append(" ORDER BY e.id");
    return jdbcTemplate.query(sql.toString(), params, this::mapRow);
  }

  public List<Long> findEndpointIdsForUser(String userId) {
    final String sql =
        """
        SELECT endpoint_id
        FROM user_notification_endpoints
        WHERE user_id = :userId
        ORDER BY endpoint_id
        """;
    return jdbcTemplate.queryForList(
        sql, new MapSqlParameterSource().addValue("userId", userId), Long.class);
  }

  public int deleteAssignments(String userId) {
    final String sql = "DELETE FROM user_notification_endpoints WHERE user_id = :userId";
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("userId", userId));
  }

  public void insertAssignments(String userId, Set<Long> endpointIds) {
    if (endpointIds.isEmpty()) {
      return;
    }
    final String sql =
        """
        INSERT INTO user_notification_endpoints (user_id, endpoint_id)
        VALUES (:userId, :endpointId)
        ON CONFLICT DO NOTHING
        """;
    final SqlParameterSource[] batch =
        endpointIds.stream()
            .map(
                endpointId ->
                    new MapSqlParameterSource()
                        .addValue("userId", userId)
                        .addValue("endpointId", endpointId))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
  }

  private static String assignedEndpointsSubquery() {
    return "SELECT u.endpoint_id FROM user_notification_endpoints u WHERE u.user_id IN (:userIds)";
  }

  private MapSqlParameterSource params(NotificationEndpointRecord record) {
    return new MapSqlParameterSource()
        .addValue("id", record.id())
        .addValue("name", record.name())
        .addValue("type", record.type().name())
        .addValue("enabled", record.enabled())
        .addValue("global", record.global())
        .addValue("eventMask", record.eventMask().value())
        .addValue("config", writeConfig(record.config()))
        .addValue("createdAt", toTimestamp(record.createdAt()))
        .addValue("updatedAt", toTimestamp(record.updatedAt()));
  }

  private String writeConfig(EndpointConfig config) {
    try {
      return objectMapper.writeValueAsString(config.values());
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("endpoint config is not serializable", ex);
    }
  }

  private EndpointConfig readConfig(String json) {
    if (json == null || json.isBlank()) {
      return EndpointConfig.empty();
    }
    try {
      return new EndpointConfig(objectMapper.readValue(json, CONFIG_TYPE));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("stored endpoint config is not valid JSON", ex);
    }
  }

  private NotificationEndpointRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationEndpointRecord(
        rs.getLong("id"),
        rs.getString("name"),
        EndpointType.valueOf(rs.getString("type")),
        rs.getBoolean("enabled"),
        rs.getBoolean("is_global"),
        new NotificationTypeMask(rs.getInt("event_mask")),
        readConfig(rs.getString("config_text")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
