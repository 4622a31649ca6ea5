/*
 * Where: Scheduler API model
 * What: Notifications of one user, newest first
 * Why: Fixes the response shape of the inbox endpoint
 */
package com.notifyhub.scheduler.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationInboxResponse(String userId, List<NotificationSummary> notifications) {
  public NotificationInboxResponse {
    // SpotBugs EI_EXPOSE_REP: keep an immutable copy
    notifications = notifications == null ? List.of() : List.copyOf(notifications);
  }
}
