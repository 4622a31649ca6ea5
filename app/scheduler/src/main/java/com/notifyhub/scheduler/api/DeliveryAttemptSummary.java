package com.notifyhub.scheduler.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.scheduler.model.DeliveryLogRecord;
import com.notifyhub.scheduler.model.DeliveryStatus;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DeliveryAttemptSummary(
    UUID logId,
    int channelId,
    DeliveryStatus deliveryStatus,
    int deliveryAttempts,
    String errorMessage,
    String providerMessageId,
    Instant deliveredAt,
    Instant createdAt) {

  static DeliveryAttemptSummary from(DeliveryLogRecord record) {
    return new DeliveryAttemptSummary(
        record.logId(),
        record.channelId(),
        record.deliveryStatus(),
        record.deliveryAttempts(),
        record.errorMessage(),
        record.providerMessageId(),
        record.deliveredAt(),
        record.createdAt());
  }
}
