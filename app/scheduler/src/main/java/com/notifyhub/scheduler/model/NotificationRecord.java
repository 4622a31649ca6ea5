/*
 * Where: Scheduler domain model
 * What: Snapshot of one notifications row
 * Why: Shared by the executor and the read API
 */
package com.notifyhub.scheduler.model;

import java.time.Instant;
import java.util.UUID;

public record NotificationRecord(
    UUID notificationId,
    String userId,
    String templateId,
    String scheduleId,
    String departmentId,
    String subDepartmentId,
    String subject,
    String body,
    NotificationStatus status,
    Instant sentAt,
    Instant readAt,
    Instant createdAt) {}
