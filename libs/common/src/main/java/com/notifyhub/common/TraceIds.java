package com.notifyhub.common;

import java.util.UUID;

public final class TraceIds {
  private static final int SHORT_LENGTH = 8;

  private TraceIds() {}

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  /** Short id for log correlation of one worker pass. */
  public static String newPassId() {
    return newTraceId().substring(0, SHORT_LENGTH);
  }
}
