package com.acme.intake.core;

public class PermanentException extends IntakeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }

  @Override
  public FailureKind kind() {
    return FailureKind.PERMANENT;
  }
}
