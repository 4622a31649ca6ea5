/*
 * Where: Scheduler domain model
 * What: Notification lifecycle states and their allowed transitions
 * Why: The engine and the read API must agree on pending -> sent/failed, sent -> read
 */
package com.notifyhub.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationStatus {
  PENDING("pending"),
  SENT("sent"),
  FAILED("failed"),
  READ("read");

  private final String dbValue;

  NotificationStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  @JsonValue
  public String dbValue() {
    return dbValue;
  }

  public boolean canTransitionTo(NotificationStatus next) {
    return switch (this) {
      case PENDING -> next == SENT || next == FAILED;
      case SENT -> next == READ;
      case FAILED, READ -> false;
    };
  }

  public static NotificationStatus fromDbValue(String value) {
    for (NotificationStatus status : values()) {
      if (status.dbValue.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown notification status: " + value);
  }
}
