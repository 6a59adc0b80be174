/*
 * どこで: Email 配信データアクセス
 * 何を: notifications テーブルの冪等作成/claim/lease 付き更新/一覧取得を担う
 * なぜ: 同一 request_id の並行処理を DB の一意制約と条件付き UPDATE だけで直列化するため
 */
package com.example.email.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.email.model.AcquiredRecord;
import com.example.email.model.NotificationRecord;
import com.example.email.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT request_id, user_id, to_address, template_code, variables::text AS variables_text,
             status, attempts, error, locked_by, lease_until, created_at, updated_at
      FROM notifications
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<NotificationRecord> findByRequestId(String requestId) {
    final String sql = SELECT_COLUMNS + "WHERE request_id = :requestId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("requestId", requestId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * request_id が未登録なら record をそのまま登録し、登録済みなら既存行を返す。
   *
   * <p>並行実行された場合も一意制約により 1 件だけが {@code created = true} になる。
   */
  public AcquiredRecord createOrGet(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          request_id,
          user_id,
          to_address,
          template_code,
          variables,
          status,
          attempts,
          error,
          locked_by,
          lease_until,
          created_at,
          updated_at
        ) VALUES (
          :requestId,
          :userId,
          :toAddress,
          :templateCode,
          :variablesJson::jsonb,
          :status,
          :attempts,
          :error,
          :lockedBy,
          :leaseUntil,
          :createdAt,
          :updatedAt
        )
        ON CONFLICT (request_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", record.requestId())
            .addValue("userId", record.userId())
            .addValue("toAddress", record.toAddress())
            .addValue("templateCode", record.templateCode())
            .addValue("variablesJson", record.variablesJson() == null ? "{}" : record.variablesJson())
            .addValue("status", record.status().name())
            .addValue("attempts", record.attempts())
            .addValue("error", record.error())
            .addValue("lockedBy", record.lockedBy())
            .addValue("leaseUntil", toTimestamp(record.leaseUntil()))
            .addValue("createdAt", toTimestamp(record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt()));
    final boolean created = jdbcTemplate.update(sql, params) == 1;
    final NotificationRecord stored =
        findByRequestId(record.requestId())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "notification vanished after insert requestId=" + record.requestId()));
    return new AcquiredRecord(stored, created);
  }

  public Optional<NotificationRecord> claim(
      String requestId, Instant now, Instant leaseUntil, String lockedBy) {
    // PENDING、または lease 切れの PROCESSING だけを奪取できる
    final String sql =
        """
        UPDATE notifications
        SET status = 'PROCESSING',
            locked_by = :lockedBy,
            lease_until = :leaseUntil,
            updated_at = :now
        WHERE request_id = :requestId
          AND (
            status = 'PENDING'
            OR (status = 'PROCESSING' AND (lease_until IS NULL OR lease_until <= :now))
          )
        RETURNING request_id, user_id, to_address, template_code, variables::text AS variables_text,
                  status, attempts, error, locked_by, lease_until, created_at, updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("requestId", requestId)
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  /**
   * lease を保持している worker だけが状態/試行回数/エラーを書き込める。
   *
   * @return 更新件数。0 の場合は lease を失ったか試行回数が後退する書き込みだった
   */
  public int update(NotificationRecord record, String lockedBy) {
    final String sql =
        """
        UPDATE notifications
        SET status = :status,
            attempts = :attempts,
            error = :error,
            to_address = COALESCE(:toAddress, to_address),
            locked_by = NULL,
            lease_until = NULL,
            updated_at = :updatedAt
        WHERE request_id = :requestId
          AND status = 'PROCESSING'
          AND locked_by = :lockedBy
          AND attempts <= :attempts
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", record.status().name())
            .addValue("attempts", record.attempts())
            .addValue("error", record.error())
            .addValue("toAddress", record.toAddress())
            .addValue("updatedAt", toTimestamp(record.updatedAt()))
            .addValue("requestId", record.requestId())
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  public List<NotificationRecord> findPage(
      String userId, NotificationStatus status, int limit, int offset) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql =
        SELECT_COLUMNS
            + whereClause(userId, status, params)
            + " ORDER BY created_at DESC, request_id LIMIT :limit OFFSET :offset";
    params.addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public long count(String userId, NotificationStatus status) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql = "SELECT COUNT(*) FROM notifications" + whereClause(userId, status, params);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  private String whereClause(
      String userId, NotificationStatus status, MapSqlParameterSource params) {
    // null パラメータの型推論を避けるため、指定された条件だけを組み立てる
    final List<String> conditions = new ArrayList<>();
    if (userId != null) {
      conditions.add("user_id = :userId");
      params.addValue("userId", userId);
    }
    if (status != null) {
      conditions.add("status = :status");
      params.addValue("status", status.name());
    }
    return conditions.isEmpty() ? "" : " WHERE " + String.join(" AND ", conditions);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        rs.getString("request_id"),
        rs.getString("user_id"),
        rs.getString("to_address"),
        rs.getString("template_code"),
        rs.getString("variables_text"),
        NotificationStatus.valueOf(rs.getString("status")),
        rs.getInt("attempts"),
        rs.getString("error"),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("lease_until")),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
