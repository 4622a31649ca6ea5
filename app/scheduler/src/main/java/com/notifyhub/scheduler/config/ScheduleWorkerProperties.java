/*
 * Where: Scheduler configuration binding
 * What: Cadence, business zone and logging limits of the schedule worker
 * Why: Operators tune the tick and the zone that defines "today" per environment
 */
package com.notifyhub.scheduler.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.scheduler")
@Validated
public record ScheduleWorkerProperties(
    @DefaultValue("true") boolean enabled,
    @NotNull @DefaultValue("60s") Duration pollInterval,
    @NotNull @DefaultValue("10s") Duration initialDelay,
    @NotNull @DefaultValue("UTC") ZoneId zone,
    // notification_delivery_log.error_message column width
    @Positive @Max(500) @DefaultValue("500") int errorMessageMaxLength) {

  @AssertTrue(message = "notification.scheduler.poll-interval must be positive")
  public boolean isPollIntervalPositive() {
    // Duration cannot carry @Positive
    return pollInterval != null && !pollInterval.isZero() && !pollInterval.isNegative();
  }

  @AssertTrue(message = "notification.scheduler.initial-delay must not be negative")
  public boolean isInitialDelayNonNegative() {
    return initialDelay != null && !initialDelay.isNegative();
  }
}
