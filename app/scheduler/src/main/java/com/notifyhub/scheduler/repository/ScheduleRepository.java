/*
 * Where: Scheduler data access
 * What: Reads due schedules and advances their execution timestamps
 * Why: The worker only ever touches last_executed/next_execution on notification_schedules
 */
package com.notifyhub.scheduler.repository;

import static com.notifyhub.common.JdbcTimestampUtils.toInstant;
import static com.notifyhub.common.JdbcTimestampUtils.toLocalDate;
import static com.notifyhub.common.JdbcTimestampUtils.toLocalTime;
import static com.notifyhub.common.JdbcTimestampUtils.toSqlDate;
import static com.notifyhub.common.JdbcTimestampUtils.toSqlTime;
import static com.notifyhub.common.JdbcTimestampUtils.toTimestamp;

import com.notifyhub.scheduler.model.ScheduleExecutionContext;
import com.notifyhub.scheduler.model.ScheduleLock;
import com.notifyhub.scheduler.model.ScheduleType;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ScheduleRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * Active schedules of active templates whose date window contains {@code today}, whose time of
   * day has passed and which have not run since {@code startOfToday}.
   */
  public List<ScheduleExecutionContext> findDueSchedules(
      LocalDate today, LocalTime timeOfDay, Instant startOfToday) {
    final String sql =
        """
        SELECT s.schedule_id, s.template_id, t.template_name, t.subject, t.body,
               s.department_id, d.department_name,
               s.sub_department_id, sd.sub_department_name,
               s.schedule_type, s.schedule_time, s.start_date, s.end_date,
               s.template_variables, s.last_executed, s.next_execution
        FROM notification_schedules s
        JOIN notification_templates t ON t.template_id = s.template_id
        JOIN departments d ON d.department_id = s.department_id
        LEFT JOIN sub_departments sd ON sd.sub_department_id = s.sub_department_id
        WHERE s.is_active = TRUE
          AND t.is_active = TRUE
          AND s.start_date <= :today
          AND (s.end_date IS NULL OR s.end_date >= :today)
          AND s.schedule_time <= :timeOfDay
          AND (s.last_executed IS NULL OR s.last_executed < :startOfToday)
        ORDER BY s.schedule_time, s.schedule_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("today", toSqlDate(today))
            .addValue("timeOfDay", toSqlTime(timeOfDay))
            .addValue("startOfToday", toTimestamp(startOfToday));
    return jdbcTemplate.query(sql, params, this::mapContext);
  }

  /** Locks the schedule row for the current transaction and returns the fields to re-check. */
  public Optional<ScheduleLock> lockForExecution(String scheduleId) {
    final String sql =
        """
        SELECT schedule_id, is_active, last_executed
        FROM notification_schedules
        WHERE schedule_id = :scheduleId
        FOR UPDATE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scheduleId", scheduleId);
    final List<ScheduleLock> rows =
        jdbcTemplate.query(
            sql,
            params,
            (rs, rowNum) ->
                new ScheduleLock(
                    rs.getString("schedule_id"),
                    rs.getBoolean("is_active"),
                    toInstant(rs.getTimestamp("last_executed"))));
    return rows.stream().findFirst();
  }

  public int advanceExecution(
      String scheduleId, Instant lastExecuted, Instant nextExecution, Instant updatedAt) {
    // last_executed never moves backwards
    final String sql =
        """
        UPDATE notification_schedules
        SET last_executed = :lastExecuted,
            next_execution = :nextExecution,
            updated_at = :updatedAt
        WHERE schedule_id = :scheduleId
          AND (last_executed IS NULL OR last_executed <= :lastExecuted)
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("scheduleId", scheduleId)
            .addValue("lastExecuted", toTimestamp(lastExecuted))
            .addValue("nextExecution", toTimestamp(nextExecution))
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  public void checkConnectivity() {
    jdbcTemplate.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
  }

  private ScheduleExecutionContext mapContext(ResultSet rs, int rowNum) throws SQLException {
    return new ScheduleExecutionContext(
        rs.getString("schedule_id"),
        rs.getString("template_id"),
        rs.getString("template_name"),
        rs.getString("subject"),
        rs.getString("body"),
        rs.getString("department_id"),
        rs.getString("department_name"),
        rs.getString("sub_department_id"),
        rs.getString("sub_department_name"),
        ScheduleType.fromDbValue(rs.getString("schedule_type")),
        toLocalTime(rs.getTime("schedule_time")),
        toLocalDate(rs.getDate("start_date")),
        toLocalDate(rs.getDate("end_date")),
        rs.getString("template_variables"),
        toInstant(rs.getTimestamp("last_executed")),
        toInstant(rs.getTimestamp("next_execution")));
  }
}
