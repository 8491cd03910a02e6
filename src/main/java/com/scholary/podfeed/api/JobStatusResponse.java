package com.scholary.podfeed.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.podfeed.acquire.AcquisitionProgress;
import com.scholary.podfeed.job.ErrorCategory;
import com.scholary.podfeed.job.JobState;
import com.scholary.podfeed.job.JobStatus;
import java.time.Instant;
import java.util.List;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an ingest job. {@code progress} carries percent complete, transfer
 * rate and ETA while the media is downloading and is absent otherwise. {@code resultEntryId} and
 * {@code duplicate} are present once the job has completed; {@code errorCategory} and
 * {@code errorMessage} once it has failed or been cancelled.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
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

  public static JobStatusResponse from(JobStatus status) {
    return new JobStatusResponse(
        status.jobId(),
        status.state(),
        status.message(),
        status.progress(),
        status.resultEntryId(),
        status.duplicate(),
        status.errorCategory(),
        status.errorMessage(),
        status.warnings(),
        status.title(),
        status.source(),
        status.createdAt(),
        status.updatedAt());
  }
}
