package com.scholary.podfeed.media;

import com.scholary.podfeed.job.ErrorCategory;
import com.scholary.podfeed.job.PipelineException;

/**
 * Exception thrown when media storage operations fail.
 *
 * <p>Reported under the same category as feed persistence failures: both mean the durable store
 * could not be updated.
 */
public class MediaStorageException extends PipelineException {

  public MediaStorageException(String message) {
    super(ErrorCategory.FEED_PERSIST_ERROR, message);
  }

  public MediaStorageException(String message, Throwable cause) {
    super(ErrorCategory.FEED_PERSIST_ERROR, message, cause);
  }
}
