package com.notifyhub.scheduler.model;

import java.time.Instant;

/** Row-locked view of the schedule fields the executor re-checks before running. */
public record ScheduleLock(String scheduleId, boolean active, Instant lastExecuted) {}
