/*
 * Where: Scheduler dispatch layer
 * What: Delivers one rendered message to one recipient over one channel
 * Why: The executor stays independent of the transport and tests can swap it
 */
package com.notifyhub.scheduler.channel;

public interface DispatchChannel {

  /** Name matching notification_channels.channel_name. */
  String channelName();

  /**
   * Makes exactly one bounded attempt. Transport failures are reported in the result, not thrown.
   */
  DispatchResult send(OutboundMessage message);

  /** Throws {@link IllegalStateException} when the transport cannot be used. */
  void verifyReady();
}
