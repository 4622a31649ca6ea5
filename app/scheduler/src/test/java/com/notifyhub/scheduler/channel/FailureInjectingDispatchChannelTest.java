package com.notifyhub.scheduler.channel;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class FailureInjectingDispatchChannelTest {

  @Test
  void failsOnlyRecipientsMatchingThePrefix() {
    final FailureInjectingDispatchChannel channel =
        new FailureInjectingDispatchChannel(new LocalDispatchChannel());
    ReflectionTestUtils.setField(channel, "emailPrefix", "fail.");

    final DispatchResult failed =
        channel.send(new OutboundMessage("fail.ben@example.com", "s", "b", "Ben"));
    assertThat(failed.success()).isFalse();
    assertThat(failed.providerMessageId()).isNull();
    assertThat(failed.errorDetail()).contains("fail.ben@example.com");
    final DispatchResult delivered =
        channel.send(new OutboundMessage("ana@example.com", "s", "b", "Ana"));
    assertThat(delivered.success()).isTrue();
    assertThat(delivered.providerMessageId()).startsWith("local-");
    assertThat(channel.channelName()).isEqualTo(EmailDispatchChannel.CHANNEL_NAME);
  }

  @Test
  void blankPrefixInjectsNothing() {
    final FailureInjectingDispatchChannel channel =
        new FailureInjectingDispatchChannel(new LocalDispatchChannel());
    ReflectionTestUtils.setField(channel, "emailPrefix", "");

    assertThat(channel.send(new OutboundMessage("fail.ben@example.com", "s", "b", "Ben")).success())
        .isTrue();
  }
}
