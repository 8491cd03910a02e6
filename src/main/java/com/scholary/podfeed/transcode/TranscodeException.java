package com.scholary.podfeed.transcode;

import com.scholary.podfeed.job.ErrorCategory;
import com.scholary.podfeed.job.PipelineException;

/** Thrown when encoding failed and the raw file is not a playable audio container. */
public class TranscodeException extends PipelineException {

  public TranscodeException(String message) {
    super(ErrorCategory.TRANSCODE_FAILED, message);
  }

  public TranscodeException(String message, Throwable cause) {
    super(ErrorCategory.TRANSCODE_FAILED, message, cause);
  }
}
