/*
 * Where: Scheduler dispatch layer
 * What: Email channel stand-in that only logs the message
 * Why: Lets the engine run end to end where no SMTP server is configured
 */
package com.notifyhub.scheduler.channel;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnExpression("'${spring.mail.host:}'.isBlank()")
public class LocalDispatchChannel implements DispatchChannel {

  private static final Logger logger = LoggerFactory.getLogger(LocalDispatchChannel.class);

  @Override
  public String channelName() {
    return EmailDispatchChannel.CHANNEL_NAME;
  }

  @Override
  public DispatchResult send(OutboundMessage message) {
    logger.info(
        "email simulated send to={} name={} subject={}",
        message.to(),
        message.recipientName(),
        message.subject());
    return DispatchResult.delivered("local-" + UUID.randomUUID());
  }

  @Override
  public void verifyReady() {
    logger.warn("spring.mail.host is not set, emails are logged instead of sent");
  }
}
