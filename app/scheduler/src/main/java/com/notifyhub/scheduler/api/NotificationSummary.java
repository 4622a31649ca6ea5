package com.notifyhub.scheduler.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.notifyhub.scheduler.model.NotificationRecord;
import com.notifyhub.scheduler.model.NotificationStatus;
import java.time.Instant;
import java.util.UUID;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NotificationSummary(
    UUID notificationId,
    String scheduleId,
    String templateId,
    String subject,
    String body,
    NotificationStatus status,
    Instant createdAt,
    Instant sentAt,
    Instant readAt) {

  static NotificationSummary from(NotificationRecord record) {
    return new NotificationSummary(
        record.notificationId(),
        record.scheduleId(),
        record.templateId(),
        record.subject(),
        record.body(),
        record.status(),
        record.createdAt(),
        record.sentAt(),
        record.readAt());
  }
}
