/*
 * Where: Scheduler domain model
 * What: Closed set of recurrence types stored in notification_schedules.schedule_type
 * Why: Keep the DB literal and the recurrence logic on one enum
 */
package com.notifyhub.scheduler.model;

public enum ScheduleType {
  ONCE("once"),
  DAILY("daily"),
  WEEKLY("weekly"),
  MONTHLY("monthly");

  private final String dbValue;

  ScheduleType(String dbValue) {
    this.dbValue = dbValue;
  }

  public String dbValue() {
    return dbValue;
  }

  public static ScheduleType fromDbValue(String value) {
    for (ScheduleType type : values()) {
      if (type.dbValue.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown schedule type: " + value);
  }
}
