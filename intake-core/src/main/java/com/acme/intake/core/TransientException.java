package com.acme.intake.core;

public class TransientException extends IntakeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }

  @Override
  public FailureKind kind() {
    return FailureKind.TRANSIENT;
  }
}
