package com.notifyhub.scheduler.api;

import com.notifyhub.scheduler.service.ScheduleWorker;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class StatusController {

  private final ScheduleWorker scheduleWorker;

  @GetMapping("/")
  public String home() {
    return scheduleWorker.isRunning() ? "scheduler: ok (pass running)" : "scheduler: ok";
  }
}
