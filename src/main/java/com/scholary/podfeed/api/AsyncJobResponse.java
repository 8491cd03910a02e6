package com.scholary.podfeed.api;

/**
 * Response for an accepted ingest job.
 *
 * <p>Returns a job ID and the URL to poll for its status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {

  public static AsyncJobResponse forJob(String jobId) {
    return new AsyncJobResponse(jobId, "/api/jobs/" + jobId);
  }
}
