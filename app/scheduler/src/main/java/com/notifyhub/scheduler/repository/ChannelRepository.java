package com.notifyhub.scheduler.repository;

import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ChannelRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<Integer> findActiveChannelId(String channelName) {
    final String sql =
        """
        SELECT channel_id
        FROM notification_channels
        WHERE channel_name = :channelName
          AND is_active = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("channelName", channelName);
    final List<Integer> ids =
        jdbcTemplate.query(sql, params, (rs, rowNum) -> rs.getInt("channel_id"));
    return ids.stream().findFirst();
  }
}
