package com.scholary.podfeed.job;

/** Stable failure categories surfaced to callers alongside the human-readable message. */
public enum ErrorCategory {
  INVALID_SOURCE,
  ACQUISITION_FAILED,
  TRANSCODE_FAILED,
  FEED_PERSIST_ERROR,
  CANCELLED,
  INTERNAL
}
