package com.scholary.podfeed.source;

import com.scholary.podfeed.job.ErrorCategory;
import com.scholary.podfeed.job.PipelineException;

/**
 * Thrown when a source string cannot be normalized into a canonical source id.
 *
 * <p>Raised synchronously on submission; a rejected source never creates a job.
 */
public class InvalidSourceException extends PipelineException {

  public InvalidSourceException(String message) {
    super(ErrorCategory.INVALID_SOURCE, message);
  }
}
