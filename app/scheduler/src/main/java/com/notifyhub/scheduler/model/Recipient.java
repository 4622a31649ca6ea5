package com.notifyhub.scheduler.model;

public record Recipient(
    String userId, String firstName, String lastName, String email, String phoneNumber) {

  public String displayName() {
    return (nullToEmpty(firstName) + " " + nullToEmpty(lastName)).trim();
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
