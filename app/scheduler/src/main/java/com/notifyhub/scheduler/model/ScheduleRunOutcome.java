package com.notifyhub.scheduler.model;

public enum ScheduleRunOutcome {
  EXECUTED("executed"),
  SKIPPED("skipped"),
  NO_RECIPIENTS("no_recipients"),
  FAILED("failed");

  private final String metricTag;

  ScheduleRunOutcome(String metricTag) {
    this.metricTag = metricTag;
  }

  public String metricTag() {
    return metricTag;
  }
}
