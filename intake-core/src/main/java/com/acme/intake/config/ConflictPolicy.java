package com.acme.intake.config;

/** What the loader does when a unique key was already committed from a different file. */
public enum ConflictPolicy {
  /** Overwrite the non-key columns. The later commit wins. */
  LAST_WRITE_WINS,
  /** Fail the incoming job permanently. */
  REJECT
}
