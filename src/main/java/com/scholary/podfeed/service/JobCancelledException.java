package com.scholary.podfeed.service;

/** Raised inside a worker when its job was cancelled between two stages. */
class JobCancelledException extends RuntimeException {

  JobCancelledException(String jobId) {
    super("Job cancelled: " + jobId);
  }
}
