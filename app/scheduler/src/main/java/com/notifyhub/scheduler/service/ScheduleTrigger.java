/*
 * Where: Scheduler trigger
 * What: Fires a worker pass at a fixed rate once the store and channel are ready
 * Why: Ticks must not start before the dependencies work and must stop on shutdown
 */
package com.notifyhub.scheduler.service;

import com.notifyhub.scheduler.channel.DispatchChannel;
import com.notifyhub.scheduler.repository.ScheduleRepository;
import jakarta.annotation.PreDestroy;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "notification.scheduler.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class ScheduleTrigger {

  private static final Logger logger = LoggerFactory.getLogger(ScheduleTrigger.class);

  private final ScheduleWorker worker;
  private final ScheduleRepository scheduleRepository;
  private final DispatchChannel dispatchChannel;

  private final AtomicBoolean armed = new AtomicBoolean(false);
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  @EventListener(ApplicationReadyEvent.class)
  public void onApplicationReady() {
    tryArm();
  }

  @Scheduled(
      fixedRateString = "${notification.scheduler.poll-interval:60s}",
      initialDelayString = "${notification.scheduler.initial-delay:10s}")
  public void tick() {
    if (stopped.get()) {
      return;
    }
    // a failed readiness check at start-up is retried on every tick
    if (!armed.get() && !tryArm()) {
      return;
    }
    worker.runPass();
  }

  /** Disarms the trigger; an in-flight pass finishes on its own. Calling it twice is a no-op. */
  @PreDestroy
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    armed.set(false);
    logger.info("schedule trigger stopped");
  }

  public boolean isArmed() {
    return armed.get();
  }

  boolean tryArm() {
    if (stopped.get()) {
      return false;
    }
    try {
      scheduleRepository.checkConnectivity();
      dispatchChannel.verifyReady();
    } catch (DataAccessException | IllegalStateException ex) {
      logger.error(
          "schedule trigger not armed, readiness check failed channel={}",
          dispatchChannel.channelName(),
          ex);
      return false;
    }
    if (armed.compareAndSet(false, true)) {
      logger.info("schedule trigger armed channel={}", dispatchChannel.channelName());
    }
    return true;
  }
}
