package com.scholary.podfeed.job;

/** Thrown when a job cannot be accepted because the worker queue is full. */
public class JobRejectedException extends RuntimeException {

  public JobRejectedException(String message) {
    super(message);
  }

  public JobRejectedException(String message, Throwable cause) {
    super(message, cause);
  }
}
