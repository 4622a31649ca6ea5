/*
 * Where: Scheduler data access
 * What: Resolves the active users assigned to a schedule
 * Why: Inactive users stay assigned but never receive notifications
 */
package com.notifyhub.scheduler.repository;

import com.notifyhub.scheduler.model.Recipient;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RecipientRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public List<Recipient> findActiveRecipients(String scheduleId) {
    final String sql =
        """
        SELECT u.user_id, u.first_name, u.last_name, u.email, u.phone_number
        FROM schedule_recipients sr
        JOIN users u ON u.user_id = sr.user_id
        WHERE sr.schedule_id = :scheduleId
          AND u.is_active = TRUE
        ORDER BY u.user_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("scheduleId", scheduleId);
    return jdbcTemplate.query(
        sql,
        params,
        (rs, rowNum) ->
            new Recipient(
                rs.getString("user_id"),
                rs.getString("first_name"),
                rs.getString("last_name"),
                rs.getString("email"),
                rs.getString("phone_number")));
  }
}
