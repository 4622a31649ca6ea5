/*
 * Where: Scheduler configuration binding
 * What: Sender identity and SMTP transport timeouts of the email channel
 * Why: One unreachable mail server must not stall a whole worker pass
 */
package com.notifyhub.scheduler.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "notification.mail")
@Validated
public record MailChannelProperties(
    @NotBlank @Email String fromAddress,
    @NotBlank @DefaultValue("Notification System") String fromName,
    @NotNull @DefaultValue("10s") Duration connectTimeout,
    @NotNull @DefaultValue("15s") Duration readTimeout,
    @NotNull @DefaultValue("15s") Duration writeTimeout) {

  @AssertTrue(message = "notification.mail timeouts must be positive")
  public boolean isTimeoutsPositive() {
    return isPositive(connectTimeout) && isPositive(readTimeout) && isPositive(writeTimeout);
  }

  private boolean isPositive(Duration duration) {
    // null is reported by @NotNull
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
