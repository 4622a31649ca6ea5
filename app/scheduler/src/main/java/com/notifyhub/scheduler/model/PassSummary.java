package com.notifyhub.scheduler.model;

/** Counts of one worker pass, per schedule outcome. */
public record PassSummary(
    String passId, int selected, int executed, int skipped, int noRecipients, int failed) {}
