package com.notifyhub.scheduler.channel;

public record DispatchResult(boolean success, String providerMessageId, String errorDetail) {

  public static DispatchResult delivered(String providerMessageId) {
    return new DispatchResult(true, providerMessageId, null);
  }

  public static DispatchResult failed(String errorDetail) {
    return new DispatchResult(false, null, errorDetail == null ? "unknown error" : errorDetail);
  }
}
