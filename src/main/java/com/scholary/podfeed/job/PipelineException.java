package com.scholary.podfeed.job;

/**
 * Base type for failures that end an ingest job.
 *
 * <p>Unchecked. The orchestrator is the only place that catches these; it records the category
 * on the job instead of rethrowing.
 */
public abstract class PipelineException extends RuntimeException {

  private final ErrorCategory category;

  protected PipelineException(ErrorCategory category, String message) {
    super(message);
    this.category = category;
  }

  protected PipelineException(ErrorCategory category, String message, Throwable cause) {
    super(message, cause);
    this.category = category;
  }

  public ErrorCategory category() {
    return category;
  }
}
