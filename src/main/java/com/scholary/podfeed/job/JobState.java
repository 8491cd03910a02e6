package com.scholary.podfeed.job;

/**
 * Lifecycle of an ingest job.
 *
 * <p>Jobs only move forward: {@code PENDING → ACQUIRING → TRANSCODING → PUBLISHING → COMPLETED}.
 * Any non-terminal state may end in {@code FAILED}; {@code CANCELLED} is a failure variant that
 * is only reachable before publishing starts.
 */
public enum JobState {
  PENDING,
  ACQUIRING,
  TRANSCODING,
  PUBLISHING,
  COMPLETED,
  FAILED,
  CANCELLED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == CANCELLED;
  }

  /** Whether a job in this state can still be cancelled. */
  public boolean isCancellable() {
    return this == PENDING || this == ACQUIRING || this == TRANSCODING;
  }

  /** Whether moving to {@code next} is a legal forward step. */
  public boolean canAdvanceTo(JobState next) {
    if (isTerminal()) {
      return false;
    }
    if (next == FAILED) {
      return true;
    }
    if (next == CANCELLED) {
      return isCancellable();
    }
    return next.ordinal() == ordinal() + 1;
  }
}
