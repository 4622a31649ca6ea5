/*
 * Where: Scheduler read API
 * What: Inbox per user, delivery audit per notification, and the read acknowledgement
 * Why: Downstream consumers read what the worker produced without touching the tables
 */
package com.notifyhub.scheduler.api;

import com.notifyhub.scheduler.model.NotificationRecord;
import com.notifyhub.scheduler.model.NotificationStatus;
import com.notifyhub.scheduler.repository.DeliveryLogRepository;
import com.notifyhub.scheduler.repository.NotificationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/notifications")
@RequiredArgsConstructor
public class NotificationQueryController {

  private static final Logger logger = LoggerFactory.getLogger(NotificationQueryController.class);

  private final NotificationRepository notificationRepository;
  private final DeliveryLogRepository deliveryLogRepository;
  private final Clock clock;

  @GetMapping("/users/{userId}")
  public NotificationInboxResponse inbox(@PathVariable("userId") String userId) {
    final List<NotificationSummary> items =
        notificationRepository.findByUserId(userId).stream()
            .map(NotificationSummary::from)
            .toList();
    return new NotificationInboxResponse(userId, items);
  }

  @GetMapping("/{notificationId}/deliveries")
  public DeliveryHistoryResponse deliveries(@PathVariable("notificationId") UUID notificationId) {
    final NotificationRecord notification = requireNotification(notificationId);
    final List<DeliveryAttemptSummary> deliveries =
        deliveryLogRepository.findByNotificationId(notificationId).stream()
            .map(DeliveryAttemptSummary::from)
            .toList();
    return new DeliveryHistoryResponse(notificationId, notification.status(), deliveries);
  }

  @PostMapping("/{notificationId}/read")
  public NotificationSummary markRead(@PathVariable("notificationId") UUID notificationId) {
    final NotificationRecord notification = requireNotification(notificationId);
    if (!notification.status().canTransitionTo(NotificationStatus.READ)) {
      throw new ResponseStatusException(
          HttpStatus.CONFLICT,
          "notification cannot be marked read from status " + notification.status().dbValue());
    }
    final int updated = notificationRepository.markRead(notificationId, Instant.now(clock));
    if (updated == 0) {
      // status changed between the read and the update
      logger.warn("notification read acknowledgement lost a race id={}", notificationId);
      throw new ResponseStatusException(HttpStatus.CONFLICT, "notification status changed");
    }
    return NotificationSummary.from(requireNotification(notificationId));
  }

  private NotificationRecord requireNotification(UUID notificationId) {
    return notificationRepository
        .findById(notificationId)
        .orElseThrow(
            () ->
                new ResponseStatusException(
                    HttpStatus.NOT_FOUND, "notification not found id=" + notificationId));
  }
}
