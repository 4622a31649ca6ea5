package com.notifyhub.scheduler.model;

public record ScheduleRunResult(
    String scheduleId, ScheduleRunOutcome outcome, int sentCount, int failedCount) {

  public static ScheduleRunResult of(String scheduleId, ScheduleRunOutcome outcome) {
    return new ScheduleRunResult(scheduleId, outcome, 0, 0);
  }
}
