package com.notifyhub.scheduler.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DeliveryStatus {
  PENDING("pending"),
  DELIVERED("delivered"),
  FAILED("failed"),
  BOUNCED("bounced");

  private final String dbValue;

  DeliveryStatus(String dbValue) {
    this.dbValue = dbValue;
  }

  @JsonValue
  public String dbValue() {
    return dbValue;
  }

  public static DeliveryStatus fromDbValue(String value) {
    for (DeliveryStatus status : values()) {
      if (status.dbValue.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown delivery status: " + value);
  }
}
