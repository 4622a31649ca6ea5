package com.notifyhub.scheduler.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.scheduler.model.NotificationStatus;
import java.util.List;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryHistoryResponse(
    UUID notificationId, NotificationStatus status, List<DeliveryAttemptSummary> deliveries) {
  public DeliveryHistoryResponse {
    deliveries = deliveries == null ? List.of() : List.copyOf(deliveries);
  }
}
