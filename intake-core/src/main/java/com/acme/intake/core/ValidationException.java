package com.acme.intake.core;

/** The spreadsheet is malformed, lacks required columns, holds no usable rows or violates a column type. */
public class ValidationException extends IntakeException {
  public ValidationException(String message) {
    super(message);
  }

  public ValidationException(String message, Throwable e) {
    super(message, e);
  }

  @Override
  public FailureKind kind() {
    return FailureKind.VALIDATION;
  }
}
