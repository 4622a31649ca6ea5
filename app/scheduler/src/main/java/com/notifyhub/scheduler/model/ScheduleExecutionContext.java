/*
 * Where: Scheduler domain model
 * What: One due schedule joined with its template and department names
 * Why: The executor renders every recipient from this snapshot without extra lookups
 */
package com.notifyhub.scheduler.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;

public record ScheduleExecutionContext(
    String scheduleId,
    String templateId,
    String templateName,
    String subject,
    String body,
    String departmentId,
    String departmentName,
    String subDepartmentId,
    String subDepartmentName,
    ScheduleType scheduleType,
    LocalTime scheduleTime,
    LocalDate startDate,
    LocalDate endDate,
    String templateVariables,
    Instant lastExecuted,
    Instant nextExecution) {}
