package com.scholary.podfeed.service;

import com.scholary.podfeed.acquire.AcquiredMedia;
import com.scholary.podfeed.acquire.AcquisitionException;
import com.scholary.podfeed.acquire.AcquisitionProgress;
import com.scholary.podfeed.acquire.MediaAcquirer;
import com.scholary.podfeed.acquire.MediaMetadata;
import com.scholary.podfeed.feed.FeedEntry;
import com.scholary.podfeed.feed.FeedPersistException;
import com.scholary.podfeed.feed.FeedStore;
import com.scholary.podfeed.feed.FeedStore.AddResult;
import com.scholary.podfeed.identity.ContentIdentifier;
import com.scholary.podfeed.job.ErrorCategory;
import com.scholary.podfeed.job.IngestJob;
import com.scholary.podfeed.job.JobRejectedException;
import com.scholary.podfeed.job.JobRepository;
import com.scholary.podfeed.job.JobState;
import com.scholary.podfeed.job.JobStatus;
import com.scholary.podfeed.job.PipelineException;
import com.scholary.podfeed.logging.PipelineLogger;
import com.scholary.podfeed.media.MediaStorage;
import com.scholary.podfeed.media.MediaStorage.StoredMedia;
import com.scholary.podfeed.media.MediaStorageException;
import com.scholary.podfeed.source.InvalidSourceException;
import com.scholary.podfeed.source.SourceReference;
import com.scholary.podfeed.source.SourceResolver;
import com.scholary.podfeed.transcode.AudioMimeTypes;
import com.scholary.podfeed.transcode.DurationReader;
import com.scholary.podfeed.transcode.TranscodeResult;
import com.scholary.podfeed.transcode.Transcoder;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * Runs ingest jobs: source reference in, feed entry out.
 *
 * <p>Each job moves through {@code PENDING → ACQUIRING → TRANSCODING → PUBLISHING → COMPLETED} on
 * a worker from the bounded {@code taskExecutor} pool; submission returns as soon as the job is
 * registered. Any stage may end the job in {@code FAILED} with the category of the exception that
 * stopped it. Progress and outcome are only visible through {@link #status(String)}.
 *
 * <p>Publishing an entry and deleting it both happen under the {@link EntryLocks} lock for the
 * entry id, so two jobs for the same content never race each other into the feed store.
 */
@Service
public class IngestOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(IngestOrchestrator.class);
  private final PipelineLogger pipelineLogger = new PipelineLogger(LOGGER);

  private static final String UPLOADS_DIR = "uploads";

  private final SourceResolver sourceResolver;
  private final MediaAcquirer mediaAcquirer;
  private final Transcoder transcoder;
  private final DurationReader durationReader;
  private final ContentIdentifier contentIdentifier;
  private final FeedStore feedStore;
  private final MediaStorage mediaStorage;
  private final JobRepository jobRepository;
  private final EntryLocks entryLocks;
  private final AsyncTaskExecutor taskExecutor;
  private final Clock clock;
  private final Path scratchRoot;

  public IngestOrchestrator(
      SourceResolver sourceResolver,
      MediaAcquirer mediaAcquirer,
      Transcoder transcoder,
      DurationReader durationReader,
      ContentIdentifier contentIdentifier,
      FeedStore feedStore,
      MediaStorage mediaStorage,
      JobRepository jobRepository,
      EntryLocks entryLocks,
      @Qualifier("taskExecutor") AsyncTaskExecutor taskExecutor,
      Clock clock,
      @Value("${podfeed.scratch-dir}") String scratchDir) {
    this.sourceResolver = sourceResolver;
    this.mediaAcquirer = mediaAcquirer;
    this.transcoder = transcoder;
    this.durationReader = durationReader;
    this.contentIdentifier = contentIdentifier;
    this.feedStore = feedStore;
    this.mediaStorage = mediaStorage;
    this.jobRepository = jobRepository;
    this.entryLocks = entryLocks;
    this.taskExecutor = taskExecutor;
    this.clock = clock;
    this.scratchRoot = Paths.get(scratchDir);

    try {
      Files.createDirectories(scratchRoot.resolve(UPLOADS_DIR));
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to create scratch directory: " + scratchDir, e);
    }
  }

  /**
   * Submit a remote locator.
   *
   * @return the new job's id
   * @throws InvalidSourceException if the locator is not recognised; no job is created
   * @throws JobRejectedException if the worker queue is full; no job is created
   */
  public String submitRemote(String locator, String title, String description) {
    String canonicalId = sourceResolver.resolve(locator);
    SourceReference source = SourceReference.remote(sourceResolver.canonicalLocator(canonicalId));
    return submit(source, canonicalId, title, description);
  }

  /**
   * Submit uploaded bytes. The stream is copied to the scratch area before the job is queued.
   *
   * @return the new job's id
   * @throws InvalidSourceException if the upload is empty; no job is created
   * @throws JobRejectedException if the worker queue is full; no job is created
   */
  public String submitUpload(
      InputStream content, String originalName, String title, String description) {
    String extension = Optional.ofNullable(originalName).map(AudioMimeTypes::extensionOf).orElse("");
    Path staged =
        scratchRoot
            .resolve(UPLOADS_DIR)
            .resolve(UUID.randomUUID() + (extension.isEmpty() ? "" : "." + extension));
    try {
      long size = Files.copy(content, staged, StandardCopyOption.REPLACE_EXISTING);
      if (size == 0) {
        Files.deleteIfExists(staged);
        throw new InvalidSourceException("Uploaded file is empty");
      }
    } catch (IOException e) {
      deleteQuietly(staged);
      throw new UncheckedIOException("Failed to receive upload " + originalName, e);
    }
    return submit(SourceReference.uploaded(staged, originalName), null, title, description);
  }

  /** Current state of a job, or empty if the id is unknown or has been reclaimed. */
  public Optional<JobStatus> status(String jobId) {
    return jobRepository.findById(jobId).map(IngestJob::toStatus);
  }

  /**
   * Cancel a job that has not started publishing.
   *
   * @return empty if the job is unknown, otherwise whether it is now cancelled
   */
  public Optional<Boolean> cancel(String jobId) {
    return jobRepository
        .findById(jobId)
        .map(
            job -> {
              boolean cancelled = job.cancel();
              if (cancelled) {
                LOGGER.info("Cancelled job: jobId={}", jobId);
                jobRepository.save(job);
                if (!job.getSource().isRemote()) {
                  deleteQuietly(job.getSource().uploadPath());
                }
              }
              return cancelled;
            });
  }

  /** Entries newest first, capped for presentation. */
  public List<FeedEntry> listEntries() {
    return feedStore.listEntries();
  }

  /**
   * Remove an entry and its media artifact.
   *
   * @return false if there was no such entry
   */
  public boolean deleteEntry(String entryId) {
    return entryLocks.withLock(entryId, () -> feedStore.deleteEntry(entryId).found());
  }

  private String submit(
      SourceReference source, String canonicalId, String title, String description) {
    String jobId = UUID.randomUUID().toString();
    IngestJob job = new IngestJob(jobId, source, title, description, clock);
    jobRepository.save(job);

    try {
      Future<?> execution = taskExecutor.submit(() -> runJob(job, canonicalId));
      job.attachExecution(execution);
    } catch (TaskRejectedException e) {
      jobRepository.delete(jobId);
      if (!source.isRemote()) {
        deleteQuietly(source.uploadPath());
      }
      LOGGER.warn("Rejected job, worker queue is full: source={}", source.describe());
      throw new JobRejectedException("Too many jobs in progress, try again later", e);
    }

    LOGGER.info("Created ingest job: jobId={}, source={}", jobId, source.describe());
    return jobId;
  }

  private void runJob(IngestJob job, String canonicalId) {
    String jobId = job.getJobId();
    SourceReference source = job.getSource();
    Path scratchDir = scratchRoot.resolve(jobId);
    PipelineLogger.setJobContext(jobId, source.kind().name(), source.describe());

    try {
      advanceOrStop(job, JobState.ACQUIRING, "Downloading");
      long stageStart = System.currentTimeMillis();
      pipelineLogger.logStageStarted(jobId, "acquire");
      AcquiredMedia acquired = acquire(job, canonicalId, scratchDir);
      pipelineLogger.logStageFinished(jobId, "acquire", System.currentTimeMillis() - stageStart);

      String entryId = identify(source, canonicalId, acquired.rawFile());
      MediaMetadata metadata = acquired.metadata();
      String title = chooseTitle(job, metadata, canonicalId);
      job.setTitle(title);

      advanceOrStop(job, JobState.TRANSCODING, "Converting audio");
      stageStart = System.currentTimeMillis();
      pipelineLogger.logStageStarted(jobId, "transcode");
      TranscodeResult transcoded = transcoder.transcode(acquired.rawFile(), entryId);
      if (transcoded.warning() != null) {
        job.addWarning(transcoded.warning());
      }
      Long duration = metadata.durationSeconds();
      if (duration == null) {
        duration = durationReader.durationSeconds(transcoded.artifact()).orElse(null);
      }
      pipelineLogger.logStageFinished(jobId, "transcode", System.currentTimeMillis() - stageStart);

      advanceOrStop(job, JobState.PUBLISHING, "Updating feed");
      stageStart = System.currentTimeMillis();
      pipelineLogger.logStageStarted(jobId, "publish");
      String description =
          Optional.ofNullable(job.getRequestedDescription())
              .or(() -> Optional.ofNullable(metadata.description()))
              .orElse("");
      String sourceLink = source.isRemote() ? source.locator() : null;
      boolean duplicate =
          publish(
              entryId,
              title,
              description,
              duration,
              sourceLink,
              metadata.thumbnailUrl(),
              transcoded);
      pipelineLogger.logStageFinished(jobId, "publish", System.currentTimeMillis() - stageStart);

      job.complete(entryId, duplicate);
      LOGGER.info("Job completed: jobId={}, entryId={}, duplicate={}", jobId, entryId, duplicate);

    } catch (JobCancelledException e) {
      LOGGER.info("Job stopped after cancellation: jobId={}", jobId);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      if (job.getState() != JobState.CANCELLED) {
        recordFailure(job, ErrorCategory.INTERNAL, "Interrupted");
      }
    } catch (PipelineException e) {
      recordFailure(job, e.category(), e.getMessage());
    } catch (RuntimeException e) {
      LOGGER.error("Unexpected failure in job: jobId={}", jobId, e);
      recordFailure(job, ErrorCategory.INTERNAL, "Internal error: " + e.getMessage());
    } finally {
      jobRepository.save(job);
      deleteScratch(scratchDir);
      if (!source.isRemote()) {
        deleteQuietly(source.uploadPath());
      }
      PipelineLogger.clearJobContext();
    }
  }

  private AcquiredMedia acquire(IngestJob job, String canonicalId, Path scratchDir)
      throws InterruptedException {
    SourceReference source = job.getSource();
    if (!source.isRemote()) {
      return mediaAcquirer.acquireLocal(source.uploadPath(), source.originalName(), scratchDir);
    }
    return mediaAcquirer.acquireRemote(
        canonicalId, source.locator(), scratchDir, progress -> onProgress(job, progress));
  }

  private void onProgress(IngestJob job, AcquisitionProgress progress) {
    job.updateProgress(
        progress,
        String.format(
            Locale.ROOT,
            "Downloading %.1f%% (%s, ETA %s)",
            progress.percentComplete(),
            progress.transferRate(),
            progress.estimatedTimeRemaining()));
    pipelineLogger.logJobProgress(
        job.getJobId(),
        progress.percentComplete(),
        progress.transferRate(),
        progress.estimatedTimeRemaining());
  }

  private String identify(SourceReference source, String canonicalId, Path rawFile) {
    if (source.isRemote()) {
      return contentIdentifier.forRemote(canonicalId);
    }
    try {
      return contentIdentifier.forUpload(rawFile);
    } catch (UncheckedIOException e) {
      throw new AcquisitionException("Failed to read uploaded file: " + e.getMessage(), e);
    }
  }

  /**
   * Store the artifact and add the entry, under the entry's lock.
   *
   * @return true if the entry was already in the feed
   */
  private boolean publish(
      String entryId,
      String title,
      String description,
      Long duration,
      String sourceLink,
      String imageUrl,
      TranscodeResult transcoded) {
    Path artifact = transcoded.artifact();
    String fileName =
        entryId + "." + AudioMimeTypes.extensionOf(artifact.getFileName().toString());

    return entryLocks.withLock(
        entryId,
        () -> {
          boolean known = feedStore.contains(entryId);
          StoredMedia stored =
              known
                  ? new StoredMedia(fileName, mediaStorage.urlFor(fileName), sizeOf(artifact))
                  : mediaStorage.store(artifact, fileName);

          FeedEntry entry =
              new FeedEntry(
                  entryId,
                  title,
                  description,
                  duration,
                  stored.url(),
                  transcoded.mimeType(),
                  stored.sizeBytes(),
                  clock.instant(),
                  sourceLink,
                  imageUrl);

          AddResult result;
          try {
            result = feedStore.addEntry(entry);
          } catch (FeedPersistException e) {
            if (!known) {
              removeStoredArtifact(fileName);
            }
            throw e;
          }
          return result.duplicate();
        });
  }

  private void removeStoredArtifact(String fileName) {
    try {
      mediaStorage.delete(fileName);
    } catch (MediaStorageException e) {
      LOGGER.warn("Failed to remove unpublished artifact: file={}", fileName, e);
    }
  }

  private void advanceOrStop(IngestJob job, JobState next, String message) {
    if (!job.advance(next, message)) {
      throw new JobCancelledException(job.getJobId());
    }
    jobRepository.save(job);
  }

  private void recordFailure(IngestJob job, ErrorCategory category, String message) {
    String stage = job.getState().name();
    if (job.fail(category, message)) {
      pipelineLogger.logJobFailed(job.getJobId(), stage, category.name(), message);
    }
  }

  private static String chooseTitle(IngestJob job, MediaMetadata metadata, String canonicalId) {
    if (job.getRequestedTitle() != null) {
      return job.getRequestedTitle();
    }
    if (metadata.title() != null && !metadata.title().isBlank()) {
      return metadata.title();
    }
    return canonicalId != null ? canonicalId : job.getSource().describe();
  }

  private static long sizeOf(Path file) {
    try {
      return Files.size(file);
    } catch (IOException e) {
      LOGGER.warn("Could not read artifact size: {}", file, e);
      return 0L;
    }
  }

  private static void deleteScratch(Path scratchDir) {
    try {
      FileSystemUtils.deleteRecursively(scratchDir);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete scratch directory: {}", scratchDir, e);
    }
  }

  private static void deleteQuietly(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete file: {}", file, e);
    }
  }
}
