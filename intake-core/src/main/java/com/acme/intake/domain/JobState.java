package com.acme.intake.domain;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle of a {@link Job}. SUCCEEDED and FAILED are terminal. */
public enum JobState {
  PENDING,
  PROCESSING,
  SUCCEEDED,
  RETRYING,
  FAILED;

  private static final Set<JobState> CLAIMABLE = EnumSet.of(PENDING, RETRYING);

  public boolean isTerminal() {
    return this == SUCCEEDED || this == FAILED;
  }

  public boolean isClaimable() {
    return CLAIMABLE.contains(this);
  }

  /** Legal forward transitions. Crash recovery (PROCESSING to RETRYING) is one of them. */
  public boolean canTransitionTo(JobState next) {
    return switch (this) {
      case PENDING, RETRYING -> next == PROCESSING;
      case PROCESSING -> next == SUCCEEDED || next == RETRYING || next == FAILED;
      case SUCCEEDED, FAILED -> false;
    };
  }
}
