package com.scholary.podfeed.job;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for job execution and the job registry.
 *
 * @param workerThreads jobs running at the same time
 * @param queueCapacity accepted jobs waiting for a worker; submissions beyond this are rejected
 * @param retentionMinutes how long a job stays queryable after its last update
 * @param maxSize upper bound on jobs kept in the registry
 */
@ConfigurationProperties(prefix = "podfeed.jobs")
@Validated
public record JobProperties(
    @Positive int workerThreads,
    @Min(0) int queueCapacity,
    @Positive long retentionMinutes,
    @Positive long maxSize) {

  public Duration retention() {
    return Duration.ofMinutes(retentionMinutes);
  }
}
