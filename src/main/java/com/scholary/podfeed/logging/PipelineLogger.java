package com.scholary.podfeed.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Emits ingest pipeline events with fields that log shippers can index. Event fields are
 * removed again after each call; the job context set by {@link #setJobContext} stays in place for
 * the whole job.
 */
public class PipelineLogger {

  private final Logger logger;

  public PipelineLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log stage started event. */
  public void logStageStarted(String jobId, String stage) {
    try {
      MDC.put("event_type", "stage_started");
      MDC.put("stage", stage);

      logger.info("Stage started: jobId={}, stage={}", jobId, stage);
    } finally {
      clearEventFields();
    }
  }

  /** Log stage finished event. */
  public void logStageFinished(String jobId, String stage, long elapsedMs) {
    try {
      MDC.put("event_type", "stage_finished");
      MDC.put("stage", stage);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info("Stage finished: jobId={}, stage={}, elapsed={}ms", jobId, stage, elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log download progress event. */
  public void logJobProgress(String jobId, double percentComplete, String rate, String eta) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("transferRate", rate);
      MDC.put("eta", eta);

      logger.debug(
          "Job progress: jobId={}, progress={}%, rate={}, eta={}",
          jobId, percentComplete, rate, eta);
    } finally {
      clearEventFields();
    }
  }

  /** Log encoder failure absorbed by the fallback policy. */
  public void logTranscodeFallback(String fileName, String reason) {
    try {
      MDC.put("event_type", "transcode_fallback");
      MDC.put("fileName", fileName);
      MDC.put("errorType", reason);

      logger.warn("Encoder failed, keeping untranscoded file: file={}, reason={}", fileName, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log job failure event. */
  public void logJobFailed(String jobId, String stage, String category, String message) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("stage", stage);
      MDC.put("errorType", category);

      logger.error(
          "Job failed: jobId={}, stage={}, category={}, message={}",
          jobId, stage, category, message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String sourceKind, String source) {
    MDC.put("jobId", jobId);
    MDC.put("sourceKind", sourceKind);
    MDC.put("source", source);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("sourceKind");
    MDC.remove("source");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("stage");
    MDC.remove("elapsedMs");
    MDC.remove("percentComplete");
    MDC.remove("transferRate");
    MDC.remove("eta");
    MDC.remove("fileName");
    MDC.remove("errorType");
  }
}
