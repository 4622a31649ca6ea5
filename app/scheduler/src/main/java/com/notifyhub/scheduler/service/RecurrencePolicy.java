/*
 * Where: Scheduler service layer
 * What: Decides whether a schedule is due on a given day and when it runs next
 * Why: The selector and the executor share one definition of due-ness
 */
package com.notifyhub.scheduler.service;

import com.notifyhub.scheduler.model.ScheduleType;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import org.springframework.stereotype.Component;

@Component
public class RecurrencePolicy {

  static final int WEEKLY_INTERVAL_DAYS = 7;

  public boolean isDueToday(
      ScheduleType type, LocalDate startDate, Instant lastExecuted, LocalDate today, ZoneId zone) {
    final LocalDate lastExecutedDate =
        lastExecuted == null ? null : LocalDate.ofInstant(lastExecuted, zone);
    return isDueToday(type, startDate, lastExecutedDate, today);
  }

  public boolean isDueToday(
      ScheduleType type, LocalDate startDate, LocalDate lastExecutedDate, LocalDate today) {
    if (startDate == null || startDate.isAfter(today)) {
      return false;
    }
    if (lastExecutedDate == null) {
      return true;
    }
    // at most one run per calendar day, whatever the type
    if (!lastExecutedDate.isBefore(today)) {
      return false;
    }
    return switch (type) {
      case ONCE -> false;
      case DAILY -> true;
      case WEEKLY -> ChronoUnit.DAYS.between(lastExecutedDate, today) >= WEEKLY_INTERVAL_DAYS;
      case MONTHLY ->
          today.getYear() != lastExecutedDate.getYear()
              || today.getMonth() != lastExecutedDate.getMonth();
    };
  }

  /**
   * Informational next run after a run on {@code today}; {@code null} for one-time schedules.
   * Monthly runs on a day the next month lacks are clamped to its last day.
   */
  public Instant nextExecution(
      ScheduleType type, LocalDate today, LocalTime scheduleTime, ZoneId zone) {
    final LocalDate nextDate =
        switch (type) {
          case ONCE -> null;
          case DAILY -> today.plusDays(1);
          case WEEKLY -> today.plusDays(WEEKLY_INTERVAL_DAYS);
          case MONTHLY -> today.plusMonths(1);
        };
    if (nextDate == null) {
      return null;
    }
    return nextDate.atTime(scheduleTime).atZone(zone).toInstant();
  }

  /** First instant of {@code today} in the business zone. */
  public Instant startOfDay(LocalDate today, ZoneId zone) {
    return today.atStartOfDay(zone).toInstant();
  }
}
