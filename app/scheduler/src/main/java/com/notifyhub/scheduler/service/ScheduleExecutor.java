/*
 * Where: Scheduler service layer
 * What: Runs one schedule: recipients, rendering, dispatch, delivery log, timestamp advance
 * Why: One transaction per schedule keeps a failure in one schedule away from the others
 */
package com.notifyhub.scheduler.service;

import com.google.common.annotations.VisibleForTesting;
import com.notifyhub.scheduler.channel.DispatchChannel;
import com.notifyhub.scheduler.channel.DispatchResult;
import com.notifyhub.scheduler.channel.OutboundMessage;
import com.notifyhub.scheduler.config.ScheduleWorkerProperties;
import com.notifyhub.scheduler.model.DeliveryLogRecord;
import com.notifyhub.scheduler.model.DeliveryStatus;
import com.notifyhub.scheduler.model.NotificationRecord;
import com.notifyhub.scheduler.model.NotificationStatus;
import com.notifyhub.scheduler.model.Recipient;
import com.notifyhub.scheduler.model.ScheduleExecutionContext;
import com.notifyhub.scheduler.model.ScheduleLock;
import com.notifyhub.scheduler.model.ScheduleRunOutcome;
import com.notifyhub.scheduler.model.ScheduleRunResult;
import com.notifyhub.scheduler.repository.ChannelRepository;
import com.notifyhub.scheduler.repository.DeliveryLogRepository;
import com.notifyhub.scheduler.repository.NotificationRepository;
import com.notifyhub.scheduler.repository.RecipientRepository;
import com.notifyhub.scheduler.repository.ScheduleRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@RequiredArgsConstructor
public class ScheduleExecutor {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleExecutor.class);
  private static final String MDC_SCHEDULE_ID = "schedule_id";

  // notifications.subject column width
  static final int SUBJECT_MAX_LENGTH = 500;

  private final ScheduleRepository scheduleRepository;
  private final RecipientRepository recipientRepository;
  private final NotificationRepository notificationRepository;
  private final DeliveryLogRepository deliveryLogRepository;
  private final ChannelRepository channelRepository;
  private final RecurrencePolicy recurrencePolicy;
  private final TemplateRenderer templateRenderer;
  private final TemplateVariableResolver variableResolver;
  private final DispatchChannel dispatchChannel;
  private final ScheduleMetrics metrics;
  private final ScheduleWorkerProperties properties;
  private final Clock clock;
  private final PlatformTransactionManager transactionManager;

  /**
   * Executes {@code context} as of {@code now}. Never throws: a schedule-level failure rolls the
   * whole run back and is reported as {@link ScheduleRunOutcome#FAILED}.
   */
  public ScheduleRunResult execute(ScheduleExecutionContext context, Instant now) {
    MDC.put(MDC_SCHEDULE_ID, context.scheduleId());
    try {
      ScheduleRunResult result =
          transactionTemplate().execute(status -> runInTransaction(status, context, now));
      if (result == null) {
        logger.warn("schedule run returned no result scheduleId={}", context.scheduleId());
        result = ScheduleRunResult.of(context.scheduleId(), ScheduleRunOutcome.FAILED);
      }
      metrics.recordScheduleOutcome(result.outcome());
      return result;
    } catch (RuntimeException ex) {
      // last_executed stays untouched, so the next eligible tick retries the schedule
      logger.error("schedule run rolled back scheduleId={}", context.scheduleId(), ex);
      metrics.recordScheduleOutcome(ScheduleRunOutcome.FAILED);
      return ScheduleRunResult.of(context.scheduleId(), ScheduleRunOutcome.FAILED);
    } finally {
      MDC.remove(MDC_SCHEDULE_ID);
    }
  }

  @VisibleForTesting
  TransactionTemplate transactionTemplate() {
    return new TransactionTemplate(transactionManager);
  }

  private ScheduleRunResult runInTransaction(
      TransactionStatus status, ScheduleExecutionContext context, Instant now) {
    final String scheduleId = context.scheduleId();
    final ZoneId zone = properties.zone();
    final LocalDate today = LocalDate.ofInstant(now, zone);

    final Optional<ScheduleLock> lock = scheduleRepository.lockForExecution(scheduleId);
    if (lock.isEmpty() || !lock.get().active()) {
      logger.info("schedule skipped, no longer active scheduleId={}", scheduleId);
      return ScheduleRunResult.of(scheduleId, ScheduleRunOutcome.SKIPPED);
    }
    final boolean due =
        recurrencePolicy.isDueToday(
            context.scheduleType(), context.startDate(), lock.get().lastExecuted(), today, zone);
    if (!due) {
      logger.info(
          "schedule skipped, not due scheduleId={} type={} lastExecuted={}",
          scheduleId,
          context.scheduleType(),
          lock.get().lastExecuted());
      return ScheduleRunResult.of(scheduleId, ScheduleRunOutcome.SKIPPED);
    }

    final List<Recipient> recipients = recipientRepository.findActiveRecipients(scheduleId);
    if (recipients.isEmpty()) {
      logger.warn("schedule has no active recipients scheduleId={}", scheduleId);
      return ScheduleRunResult.of(scheduleId, ScheduleRunOutcome.NO_RECIPIENTS);
    }

    final Map<String, String> scheduleVariables =
        variableResolver.parse(scheduleId, context.templateVariables());
    final int channelId =
        channelRepository
            .findActiveChannelId(dispatchChannel.channelName())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "channel not registered or inactive name="
                            + dispatchChannel.channelName()));

    int sent = 0;
    int failed = 0;
    for (Recipient recipient : recipients) {
      if (deliverToRecipient(status, context, recipient, scheduleVariables, channelId)) {
        sent++;
      } else {
        failed++;
      }
    }

    final Instant nextExecution =
        recurrencePolicy.nextExecution(
            context.scheduleType(), today, context.scheduleTime(), zone);
    final int updated =
        scheduleRepository.advanceExecution(scheduleId, now, nextExecution, Instant.now(clock));
    if (updated == 0) {
      throw new IllegalStateException("schedule advance rejected scheduleId=" + scheduleId);
    }
    logger.info(
        "schedule executed scheduleId={} recipients={} sent={} failed={} nextExecution={}",
        scheduleId,
        recipients.size(),
        sent,
        failed,
        nextExecution);
    return new ScheduleRunResult(scheduleId, ScheduleRunOutcome.EXECUTED, sent, failed);
  }

  /** Returns {@code true} when the notification ended up {@code sent}. */
  @VisibleForTesting
  boolean deliverToRecipient(
      TransactionStatus status,
      ScheduleExecutionContext context,
      Recipient recipient,
      Map<String, String> scheduleVariables,
      int channelId) {
    // a failed statement must not abort the transaction the other recipients share
    final Object savepoint = status.createSavepoint();
    try {
      final Map<String, String> variables =
          variableResolver.merge(scheduleVariables, recipient, context);
      final String subject =
          truncate(templateRenderer.render(context.subject(), variables), SUBJECT_MAX_LENGTH);
      final String body = templateRenderer.render(context.body(), variables);
      final NotificationRecord notification =
          new NotificationRecord(
              UUID.randomUUID(),
              recipient.userId(),
              context.templateId(),
              context.scheduleId(),
              context.departmentId(),
              context.subDepartmentId(),
              subject,
              body,
              NotificationStatus.PENDING,
              null,
              null,
              Instant.now(clock));
      notificationRepository.insert(notification);

      final DispatchResult result =
          dispatch(new OutboundMessage(recipient.email(), subject, body, recipient.displayName()));
      final Instant finishedAt = Instant.now(clock);
      recordDelivery(notification.notificationId(), channelId, result, finishedAt);
      final int updated =
          result.success()
              ? notificationRepository.markSent(notification.notificationId(), finishedAt)
              : notificationRepository.markFailed(notification.notificationId());
      if (updated == 0) {
        throw new IllegalStateException(
            "notification no longer pending id=" + notification.notificationId());
      }
      status.releaseSavepoint(savepoint);

      if (result.success()) {
        metrics.recordDeliveryResult(ScheduleMetrics.RESULT_SENT);
      } else {
        logger.warn(
            "notification dispatch failed scheduleId={} userId={} notificationId={} error={}",
            context.scheduleId(),
            recipient.userId(),
            notification.notificationId(),
            result.errorDetail());
        metrics.recordDeliveryResult(ScheduleMetrics.RESULT_FAILED);
      }
      return result.success();
    } catch (RuntimeException ex) {
      status.rollbackToSavepoint(savepoint);
      logger.warn(
          "recipient processing failed scheduleId={} userId={}",
          context.scheduleId(),
          recipient.userId(),
          ex);
      metrics.recordDeliveryResult(ScheduleMetrics.RESULT_FAILED);
      return false;
    }
  }

  private DispatchResult dispatch(OutboundMessage message) {
    try {
      final DispatchResult result = dispatchChannel.send(message);
      return result == null ? DispatchResult.failed("channel returned no result") : result;
    } catch (RuntimeException ex) {
      return DispatchResult.failed(ex.getMessage());
    }
  }

  private void recordDelivery(
      UUID notificationId, int channelId, DispatchResult result, Instant finishedAt) {
    final int attempt = deliveryLogRepository.nextAttemptNumber(notificationId, channelId);
    deliveryLogRepository.insert(
        new DeliveryLogRecord(
            UUID.randomUUID(),
            notificationId,
            channelId,
            result.success() ? DeliveryStatus.DELIVERED : DeliveryStatus.FAILED,
            result.success() ? null : truncateError(result.errorDetail()),
            result.providerMessageId(),
            attempt,
            result.success() ? finishedAt : null,
            finishedAt));
  }

  private String truncateError(String message) {
    if (message == null) {
      return "unknown error";
    }
    return truncate(message, properties.errorMessageMaxLength());
  }

  private static String truncate(String value, int maxLength) {
    if (value == null || value.length() <= maxLength) {
      return value;
    }
    return value.substring(0, maxLength);
  }
}
