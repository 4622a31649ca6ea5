package com.notifyhub.scheduler.channel;

public record OutboundMessage(String to, String subject, String body, String recipientName) {}
