package com.scholary.podfeed.feed;

import com.scholary.podfeed.job.ErrorCategory;
import com.scholary.podfeed.job.PipelineException;

/**
 * Thrown when the feed document cannot be written or read.
 *
 * <p>A failed write never replaces the previously persisted document.
 */
public class FeedPersistException extends PipelineException {

  public FeedPersistException(String message) {
    super(ErrorCategory.FEED_PERSIST_ERROR, message);
  }

  public FeedPersistException(String message, Throwable cause) {
    super(ErrorCategory.FEED_PERSIST_ERROR, message, cause);
  }
}
