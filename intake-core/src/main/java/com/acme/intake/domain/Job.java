package com.acme.intake.domain;

import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** One file to be ingested (pure domain object, no persistence annotations). */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Job {

  private UUID id;
  private long seq;
  private String sourceRef;
  private String payloadPath;
  private String contentHash;
  private JobState state;
  private int attemptCount;
  private String lastError;
  private Instant nextAttemptAt;
  private Instant leaseUntil;
  private String claimedBy;
  private Instant createdAt;
  private Instant updatedAt;
}
