/*
 * Where: Common utilities
 * What: Converts java.time values to and from their JDBC types explicitly
 * Why: The PostgreSQL driver cannot always infer SQL types for java.time parameters
 */
package com.notifyhub.common;

import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

public final class JdbcTimestampUtils {
  private JdbcTimestampUtils() {}

  // Instant is UTC; Timestamp.from keeps it in UTC regardless of the DB session zone
  public static Timestamp toTimestamp(Instant instant) {
    return instant == null ? null : Timestamp.from(instant);
  }

  public static Instant toInstant(Timestamp timestamp) {
    return timestamp == null ? null : timestamp.toInstant();
  }

  public static Date toSqlDate(LocalDate date) {
    return date == null ? null : Date.valueOf(date);
  }

  public static LocalDate toLocalDate(Date date) {
    return date == null ? null : date.toLocalDate();
  }

  // seconds are dropped: schedule times are HH:MM
  public static Time toSqlTime(LocalTime time) {
    return time == null ? null : Time.valueOf(time.withSecond(0).withNano(0));
  }

  public static LocalTime toLocalTime(Time time) {
    return time == null ? null : time.toLocalTime();
  }
}
