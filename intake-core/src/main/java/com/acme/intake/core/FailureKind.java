package com.acme.intake.core;

/** Classification of a failed job attempt. The queue decides retry versus dead-letter from this. */
public enum FailureKind {
  /** The file itself is unusable. Never retried. */
  VALIDATION,
  /** Network, lock or timeout trouble. Retried with backoff. */
  TRANSIENT,
  /** Retrying cannot help. Never retried. */
  PERMANENT;

  public boolean isRetryable() {
    return this == TRANSIENT;
  }
}
