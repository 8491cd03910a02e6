package com.scholary.podfeed.acquire;

import com.scholary.podfeed.job.ErrorCategory;
import com.scholary.podfeed.job.PipelineException;

/**
 * Thrown when raw media cannot be obtained: network errors, unavailable or restricted resources,
 * tool timeouts. Fatal for the job; the extraction tool's own retries are the only retries.
 */
public class AcquisitionException extends PipelineException {

  public AcquisitionException(String message) {
    super(ErrorCategory.ACQUISITION_FAILED, message);
  }

  public AcquisitionException(String message, Throwable cause) {
    super(ErrorCategory.ACQUISITION_FAILED, message, cause);
  }
}
