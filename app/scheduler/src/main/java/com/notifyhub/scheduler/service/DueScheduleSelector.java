/*
 * Where: Scheduler service layer
 * What: Returns the schedules eligible to run at a given instant
 * Why: Translates the instant into the business day and time before querying
 */
package com.notifyhub.scheduler.service;

import com.notifyhub.scheduler.config.ScheduleWorkerProperties;
import com.notifyhub.scheduler.model.ScheduleExecutionContext;
import com.notifyhub.scheduler.repository.ScheduleRepository;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DueScheduleSelector {

  private final ScheduleRepository scheduleRepository;
  private final RecurrencePolicy recurrencePolicy;
  private final ScheduleWorkerProperties properties;

  public List<ScheduleExecutionContext> selectDueSchedules(Instant now) {
    final ZoneId zone = properties.zone();
    final ZonedDateTime localNow = now.atZone(zone);
    final LocalDate today = localNow.toLocalDate();
    final LocalTime timeOfDay = localNow.toLocalTime().truncatedTo(ChronoUnit.MINUTES);
    final List<ScheduleExecutionContext> candidates =
        scheduleRepository.findDueSchedules(
            today, timeOfDay, recurrencePolicy.startOfDay(today, zone));
    // the query only knows the same-day guard; weekly/monthly spacing comes from the policy
    return candidates.stream()
        .filter(
            candidate ->
                recurrencePolicy.isDueToday(
                    candidate.scheduleType(),
                    candidate.startDate(),
                    candidate.lastExecuted(),
                    today,
                    zone))
        .toList();
  }
}
