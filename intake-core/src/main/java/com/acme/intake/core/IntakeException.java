package com.acme.intake.core;

/**
 * Base type for failures raised while a job is being processed. Each subtype carries its {@link
 * FailureKind} so callers branch on the classification, never on the message.
 */
public abstract class IntakeException extends RuntimeException {

  protected IntakeException(String message) {
    super(message);
  }

  protected IntakeException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract FailureKind kind();
}
