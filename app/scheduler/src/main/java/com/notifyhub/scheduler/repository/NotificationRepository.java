/*
 * Where: Scheduler data access
 * What: Inserts notifications and moves them through their status transitions
 * Why: Every UPDATE is guarded by the source status so an illegal transition updates nothing
 */
package com.notifyhub.scheduler.repository;

import static com.notifyhub.common.JdbcTimestampUtils.toInstant;
import static com.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import com.notifyhub.scheduler.model.NotificationRecord;
import com.notifyhub.scheduler.model.NotificationStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class NotificationRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT notification_id, user_id, template_id, schedule_id, department_id, sub_department_id,
             subject, body, status, sent_at, read_at, created_at
      FROM notifications
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public UUID insert(NotificationRecord record) {
    final String sql =
        """
        INSERT INTO notifications (
          notification_id,
          user_id,
          template_id,
          schedule_id,
          department_id,
          sub_department_id,
          subject,
          body,
          status,
          sent_at,
          read_at,
          created_at
        ) VALUES (
          :notificationId,
          :userId,
          :templateId,
          :scheduleId,
          :departmentId,
          :subDepartmentId,
          :subject,
          :body,
          :status,
          :sentAt,
          :readAt,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", record.notificationId())
            .addValue("userId", record.userId())
            .addValue("templateId", record.templateId())
            .addValue("scheduleId", record.scheduleId())
            .addValue("departmentId", record.departmentId())
            .addValue("subDepartmentId", record.subDepartmentId())
            .addValue("subject", record.subject())
            .addValue("body", record.body())
            .addValue("status", record.status().dbValue())
            .addValue("sentAt", toTimestamp(record.sentAt()))
            .addValue("readAt", toTimestamp(record.readAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
    return record.notificationId();
  }

  public Optional<NotificationRecord> findById(UUID notificationId) {
    final String sql = SELECT_COLUMNS + "WHERE notification_id = :notificationId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationRecord> findByUserId(String userId) {
    final String sql = SELECT_COLUMNS + "WHERE user_id = :userId ORDER BY created_at DESC";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<NotificationRecord> findByScheduleId(String scheduleId) {
    final String sql = SELECT_COLUMNS + "WHERE schedule_id = :scheduleId ORDER BY created_at, user_id";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scheduleId", scheduleId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSent(UUID notificationId, Instant sentAt) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'sent',
            sent_at = :sentAt
        WHERE notification_id = :notificationId
          AND status = 'pending'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  public int markFailed(UUID notificationId) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'failed'
        WHERE notification_id = :notificationId
          AND status = 'pending'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  public int markRead(UUID notificationId, Instant readAt) {
    final String sql =
        """
        UPDATE notifications
        SET status = 'read',
            read_at = :readAt
        WHERE notification_id = :notificationId
          AND status = 'sent'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("readAt", toTimestamp(readAt))
            .addValue("notificationId", notificationId);
    return jdbcTemplate.update(sql, params);
  }

  private NotificationRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NotificationRecord(
        UUID.fromString(rs.getString("notification_id")),
        rs.getString("user_id"),
        rs.getString("template_id"),
        rs.getString("schedule_id"),
        rs.getString("department_id"),
        rs.getString("sub_department_id"),
        rs.getString("subject"),
        rs.getString("body"),
        NotificationStatus.fromDbValue(rs.getString("status")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("read_at")),
        toInstant(rs.getTimestamp("created_at")));
  }
}
