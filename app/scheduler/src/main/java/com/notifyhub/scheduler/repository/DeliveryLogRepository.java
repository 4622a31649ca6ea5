/*
 * Where: Scheduler data access
 * What: Appends and reads notification_delivery_log rows
 * Why: Every dispatch attempt leaves exactly one audit row
 */
package com.notifyhub.scheduler.repository;

import static com.notifyhub.common.JdbcTimestampUtils.toInstant;
import static com.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import com.notifyhub.scheduler.model.DeliveryLogRecord;
import com.notifyhub.scheduler.model.DeliveryStatus;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeliveryLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public void insert(DeliveryLogRecord record) {
    final String sql =
        """
        INSERT INTO notification_delivery_log (
          log_id,
          notification_id,
          channel_id,
          delivery_status,
          error_message,
          provider_message_id,
          delivery_attempts,
          delivered_at,
          created_at
        ) VALUES (
          :logId,
          :notificationId,
          :channelId,
          :deliveryStatus,
          :errorMessage,
          :providerMessageId,
          :deliveryAttempts,
          :deliveredAt,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("logId", record.logId())
            .addValue("notificationId", record.notificationId())
            .addValue("channelId", record.channelId())
            .addValue("deliveryStatus", record.deliveryStatus().dbValue())
            .addValue("errorMessage", record.errorMessage())
            .addValue("providerMessageId", record.providerMessageId())
            .addValue("deliveryAttempts", record.deliveryAttempts())
            .addValue("deliveredAt", toTimestamp(record.deliveredAt()))
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  /** Attempt number for the next log row of this notification on this channel, starting at 1. */
  public int nextAttemptNumber(UUID notificationId, int channelId) {
    final String sql =
        """
        SELECT COALESCE(MAX(delivery_attempts), 0) + 1
        FROM notification_delivery_log
        WHERE notification_id = :notificationId
          AND channel_id = :channelId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("notificationId", notificationId)
            .addValue("channelId", channelId);
    final Integer next = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return next == null ? 1 : next;
  }

  public List<DeliveryLogRecord> findByNotificationId(UUID notificationId) {
    final String sql =
        """
        SELECT log_id, notification_id, channel_id, delivery_status, error_message,
               provider_message_id, delivery_attempts, delivered_at, created_at
        FROM notification_delivery_log
        WHERE notification_id = :notificationId
        ORDER BY created_at, delivery_attempts
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("notificationId", notificationId);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new DeliveryLogRecord(
                UUID.fromString(rs.getString("log_id")),
                UUID.fromString(rs.getString("notification_id")),
                rs.getInt("channel_id"),
                DeliveryStatus.fromDbValue(rs.getString("delivery_status")),
                rs.getString("error_message"),
                rs.getString("provider_message_id"),
                rs.getInt("delivery_attempts"),
                toInstant(rs.getTimestamp("delivered_at")),
                toInstant(rs.getTimestamp("created_at"))));
  }
}
