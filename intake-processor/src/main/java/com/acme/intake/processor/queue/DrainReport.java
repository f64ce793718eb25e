package com.acme.intake.processor.queue;

/** Outcome counts of the jobs a pass recorded. */
public record DrainReport(int succeeded, int duplicates, int retried, int failed) {

  private static final DrainReport EMPTY = new DrainReport(0, 0, 0, 0);

  public static DrainReport empty() {
    return EMPTY;
  }

  static DrainReport ofSucceeded() {
    return new DrainReport(1, 0, 0, 0);
  }

  static DrainReport ofDuplicate() {
    return new DrainReport(0, 1, 0, 0);
  }

  static DrainReport ofRetried() {
    return new DrainReport(0, 0, 1, 0);
  }

  static DrainReport ofFailed() {
    return new DrainReport(0, 0, 0, 1);
  }

  public DrainReport plus(DrainReport other) {
    return new DrainReport(
        succeeded + other.succeeded,
        duplicates + other.duplicates,
        retried + other.retried,
        failed + other.failed);
  }

  public int total() {
    return succeeded + duplicates + retried + failed;
  }
}
