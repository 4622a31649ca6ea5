/*
 * Where: Scheduler service layer
 * What: Records worker pass, schedule outcome and delivery result metrics
 * Why: Missed ticks, rolled back schedules and failing channels show up in Prometheus
 */
package com.notifyhub.scheduler.service;

import com.notifyhub.scheduler.model.ScheduleRunOutcome;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component")
public class ScheduleMetrics {

  static final String METRIC_PASS_DURATION = "notification.scheduler.pass.duration";
  static final String METRIC_PASS_SKIPPED = "notification.scheduler.pass.skipped";
  static final String METRIC_SCHEDULE_TOTAL = "notification.scheduler.schedule.total";
  static final String METRIC_DELIVERY_TOTAL = "notification.delivery.total";

  public static final String RESULT_SENT = "sent";
  public static final String RESULT_FAILED = "failed";

  private final MeterRegistry meterRegistry;
  private final ConcurrentMap<String, Counter> scheduleCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final Counter passSkippedCounter;
  private final Timer passDurationTimer;

  public ScheduleMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    this.passSkippedCounter =
        Counter.builder(METRIC_PASS_SKIPPED)
            .description("Ticks skipped because the previous pass was still running")
            .register(meterRegistry);
    this.passDurationTimer =
        Timer.builder(METRIC_PASS_DURATION)
            .description("Wall time of one schedule worker pass")
            .register(meterRegistry);
  }

  public void recordPassDuration(Duration duration) {
    if (duration == null || duration.isNegative()) {
      return;
    }
    passDurationTimer.record(duration);
  }

  public void recordPassSkipped() {
    passSkippedCounter.increment();
  }

  public void recordScheduleOutcome(ScheduleRunOutcome outcome) {
    scheduleCounters
        .computeIfAbsent(
            outcome.metricTag(),
            tag ->
                Counter.builder(METRIC_SCHEDULE_TOTAL)
                    .description("Schedule runs by outcome")
                    .tags(Tags.of("outcome", tag))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDeliveryResult(String result) {
    deliveryCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Notification dispatch outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }
}
