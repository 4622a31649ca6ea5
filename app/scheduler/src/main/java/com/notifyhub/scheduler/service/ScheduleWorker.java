/*
 * Where: Scheduler service layer
 * What: One worker pass: select due schedules and execute them in order
 * Why: Owns the guard that keeps two passes from running at the same time
 */
package com.notifyhub.scheduler.service;

import com.notifyhub.common.TraceIds;
import com.notifyhub.scheduler.model.PassSummary;
import com.notifyhub.scheduler.model.ScheduleExecutionContext;
import com.notifyhub.scheduler.model.ScheduleRunResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class ScheduleWorker {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleWorker.class);
  private static final String MDC_PASS_ID = "pass_id";

  private final DueScheduleSelector selector;
  private final ScheduleExecutor executor;
  private final ScheduleMetrics metrics;
  private final Clock clock;

  private final AtomicBoolean running = new AtomicBoolean(false);

  /**
   * Runs one pass unless another one is in flight. Returns empty when the pass was skipped or
   * aborted before any schedule was attempted.
   */
  public Optional<PassSummary> runPass() {
    if (!running.compareAndSet(false, true)) {
      logger.warn("schedule worker pass skipped, previous pass still running");
      metrics.recordPassSkipped();
      return Optional.empty();
    }
    final String passId = TraceIds.newPassId();
    MDC.put(MDC_PASS_ID, passId);
    final Instant startedAt = Instant.now(clock);
    try {
      return Optional.of(processDueSchedules(passId, startedAt));
    } catch (RuntimeException ex) {
      logger.error("schedule worker pass aborted passId={}", passId, ex);
      return Optional.empty();
    } finally {
      final Duration elapsed = Duration.between(startedAt, Instant.now(clock));
      metrics.recordPassDuration(elapsed);
      logger.info("schedule worker pass finished passId={} elapsedMs={}", passId, elapsed.toMillis());
      MDC.remove(MDC_PASS_ID);
      running.set(false);
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  private PassSummary processDueSchedules(String passId, Instant now) {
    final List<ScheduleExecutionContext> due = selector.selectDueSchedules(now);
    if (due.isEmpty()) {
      logger.debug("no schedules due passId={} now={}", passId, now);
      return new PassSummary(passId, 0, 0, 0, 0, 0);
    }
    logger.info("schedule worker pass started passId={} due={}", passId, due.size());
    int executed = 0;
    int skipped = 0;
    int noRecipients = 0;
    int failed = 0;
    for (ScheduleExecutionContext context : due) {
      final ScheduleRunResult result = executor.execute(context, now);
      switch (result.outcome()) {
        case EXECUTED -> executed++;
        case SKIPPED -> skipped++;
        case NO_RECIPIENTS -> noRecipients++;
        case FAILED -> failed++;
      }
    }
    final PassSummary summary =
        new PassSummary(passId, due.size(), executed, skipped, noRecipients, failed);
    logger.info(
        "schedule worker pass summary passId={} selected={} executed={} skipped={} noRecipients={} failed={}",
        passId,
        summary.selected(),
        summary.executed(),
        summary.skipped(),
        summary.noRecipients(),
        summary.failed());
    return summary;
  }
}
