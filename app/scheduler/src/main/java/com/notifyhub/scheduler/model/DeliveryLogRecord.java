package com.notifyhub.scheduler.model;

import java.time.Instant;
import java.util.UUID;

public record DeliveryLogRecord(
    UUID logId,
    UUID notificationId,
    int channelId,
    DeliveryStatus deliveryStatus,
    String errorMessage,
    String providerMessageId,
    int deliveryAttempts,
    Instant deliveredAt,
    Instant createdAt) {}
