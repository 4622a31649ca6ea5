/*
 * Where: Scheduler dispatch layer
 * What: CI/test-only channel that fails for recipients matching an email prefix
 * Why: Reproduce mixed sent/failed runs end to end without touching the real channel
 */
package com.notifyhub.scheduler.channel;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

@Component
@Primary
@RequiredArgsConstructor
@Profile({"ci", "test"})
@ConditionalOnProperty(
    prefix = "notification.dispatch.failure-injection",
    name = "enabled",
    havingValue = "true")
public class FailureInjectingDispatchChannel implements DispatchChannel {

  private final LocalDispatchChannel delegate;

  @Value("${notification.dispatch.failure-injection.email-prefix:}")
  private String emailPrefix;

  @Override
  public String channelName() {
    return delegate.channelName();
  }

  @Override
  public DispatchResult send(OutboundMessage message) {
    if (shouldInjectFailure(message.to())) {
      return DispatchResult.failed(
          "dispatch failure injection matched recipient=" + message.to());
    }
    return delegate.send(message);
  }

  @Override
  public void verifyReady() {
    delegate.verifyReady();
  }

  private boolean shouldInjectFailure(String to) {
    if (emailPrefix == null || emailPrefix.isBlank() || to == null) {
      return false;
    }
    return to.startsWith(emailPrefix);
  }
}
