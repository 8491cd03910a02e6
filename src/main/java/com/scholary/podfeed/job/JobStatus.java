package com.scholary.podfeed.job;

import com.scholary.podfeed.acquire.AcquisitionProgress;
import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a job's observable state at one moment.
 *
 * @param progress latest download sample while acquiring, otherwise null
 * @param duplicate only set once the job has completed
 */
public record JobStatus(
    String jobId,
    JobState state,
    String message,
    AcquisitionProgress progress,
    String resultEntryId,
    Boolean duplicate,
    ErrorCategory errorCategory,
    String errorMessage,
    List<String> warnings,
    String title,
    String source,
    Instant createdAt,
    Instant updatedAt) {

  public JobStatus {
    warnings = List.copyOf(warnings);
  }
}
