package com.acme.intake.domain;

import com.acme.intake.core.FailureKind;
import com.acme.intake.core.IntakeException;

/** Result of one processing attempt, as data. */
public record AttemptOutcome(Type type, FailureKind failureKind, String detail, int committedCount) {

  public enum Type {
    SUCCEEDED,
    DUPLICATE,
    FAILED
  }

  public static AttemptOutcome succeeded(int committedCount) {
    return new AttemptOutcome(Type.SUCCEEDED, null, null, committedCount);
  }

  public static AttemptOutcome duplicate(String detail) {
    return new AttemptOutcome(Type.DUPLICATE, null, detail, 0);
  }

  public static AttemptOutcome failed(IntakeException e) {
    return new AttemptOutcome(Type.FAILED, e.kind(), e.getMessage(), 0);
  }

  public static AttemptOutcome failed(FailureKind kind, String detail) {
    return new AttemptOutcome(Type.FAILED, kind, detail, 0);
  }

  public boolean isSuccess() {
    return type != Type.FAILED;
  }

  public boolean isRetryable() {
    return type == Type.FAILED && failureKind.isRetryable();
  }
}
