package com.scholary.podfeed.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of ingest jobs.
 *
 * <p>Backed by a Caffeine cache: jobs are dropped {@code retention} after their last save, and
 * the registry never holds more than {@code maxSize} jobs. Status queries for a reclaimed job
 * behave like queries for an unknown id.
 */
@Repository
public class JobRepository {

  private final Cache<String, IngestJob> cache;

  @Autowired
  public JobRepository(JobProperties properties) {
    this(properties, Ticker.systemTicker());
  }

  JobRepository(JobProperties properties, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.maxSize())
            .expireAfterWrite(properties.retention())
            .ticker(ticker)
            .build();
  }

  /** Store the job, restarting its retention period. */
  public void save(IngestJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<IngestJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }
}
