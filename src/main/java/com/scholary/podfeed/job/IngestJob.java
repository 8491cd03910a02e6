package com.scholary.podfeed.job;

import com.scholary.podfeed.acquire.AcquisitionProgress;
import com.scholary.podfeed.source.SourceReference;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;

/**
 * One ingest job: a source reference moving through the pipeline.
 *
 * <p>Mutated by exactly one worker thread and read by any number of status pollers, so every
 * accessor is synchronized and readers get an immutable {@link JobStatus} copy. Transitions that
 * would move the job backwards or out of a terminal state are refused and reported as
 * {@code false}; that is how a worker notices a cancellation that happened under it.
 */
public class IngestJob {

  private final String jobId;
  private final SourceReference source;
  private final String requestedTitle;
  private final String requestedDescription;
  private final Clock clock;
  private final Instant createdAt;
  private final List<String> warnings = new ArrayList<>();

  private JobState state;
  private String message;
  private AcquisitionProgress progress;
  private String resultEntryId;
  private Boolean duplicate;
  private ErrorCategory errorCategory;
  private String errorMessage;
  private String title;
  private Instant updatedAt;
  private Future<?> execution;

  public IngestJob(
      String jobId,
      SourceReference source,
      String requestedTitle,
      String requestedDescription,
      Clock clock) {
    this.jobId = jobId;
    this.source = source;
    this.requestedTitle = blankToNull(requestedTitle);
    this.requestedDescription = blankToNull(requestedDescription);
    this.clock = clock;
    this.createdAt = clock.instant();
    this.updatedAt = createdAt;
    this.state = JobState.PENDING;
    this.message = "Queued";
    this.title = this.requestedTitle;
  }

  public String getJobId() {
    return jobId;
  }

  public SourceReference getSource() {
    return source;
  }

  public String getRequestedTitle() {
    return requestedTitle;
  }

  public String getRequestedDescription() {
    return requestedDescription;
  }

  public synchronized JobState getState() {
    return state;
  }

  /**
   * Move to the next pipeline stage.
   *
   * @return false if the job is no longer allowed to move there (cancelled or finished)
   */
  public synchronized boolean advance(JobState next, String newMessage) {
    if (!state.canAdvanceTo(next) || next.isTerminal()) {
      return false;
    }
    state = next;
    message = newMessage;
    progress = null;
    touch();
    return true;
  }

  /**
   * Record a download progress sample; ignored unless the job is still acquiring. Any later
   * transition drops it again.
   */
  public synchronized void updateProgress(AcquisitionProgress sample, String newMessage) {
    if (state != JobState.ACQUIRING) {
      return;
    }
    progress =
        new AcquisitionProgress(
            Math.max(0.0, Math.min(100.0, sample.percentComplete())),
            sample.transferRate(),
            sample.estimatedTimeRemaining());
    message = newMessage;
    touch();
  }

  public synchronized void setTitle(String title) {
    this.title = title;
    touch();
  }

  public synchronized void addWarning(String warning) {
    warnings.add(warning);
    touch();
  }

  public synchronized boolean complete(String entryId, boolean wasDuplicate) {
    if (state != JobState.PUBLISHING) {
      return false;
    }
    state = JobState.COMPLETED;
    resultEntryId = entryId;
    duplicate = wasDuplicate;
    progress = null;
    message = wasDuplicate ? "Already in feed" : "Published";
    touch();
    return true;
  }

  public synchronized boolean fail(ErrorCategory category, String error) {
    if (state.isTerminal()) {
      return false;
    }
    state = JobState.FAILED;
    progress = null;
    errorCategory = category;
    errorMessage = error;
    message = error;
    touch();
    return true;
  }

  /**
   * Cancel the job if it has not started publishing, interrupting its worker.
   *
   * @return true if the job is now cancelled
   */
  public synchronized boolean cancel() {
    if (!state.isCancellable()) {
      return false;
    }
    state = JobState.CANCELLED;
    progress = null;
    errorCategory = ErrorCategory.CANCELLED;
    errorMessage = "Cancelled";
    message = "Cancelled";
    touch();
    if (execution != null) {
      execution.cancel(true);
    }
    return true;
  }

  /** Attach the worker future so {@link #cancel()} can interrupt it. */
  public synchronized void attachExecution(Future<?> future) {
    this.execution = future;
    if (state == JobState.CANCELLED) {
      future.cancel(true);
    }
  }

  public synchronized JobStatus toStatus() {
    return new JobStatus(
        jobId,
        state,
        message,
        progress,
        resultEntryId,
        duplicate,
        errorCategory,
        errorMessage,
        warnings,
        title,
        source.describe(),
        createdAt,
        updatedAt);
  }

  private void touch() {
    updatedAt = clock.instant();
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
