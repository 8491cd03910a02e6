package com.scholary.podfeed.config;

import com.scholary.podfeed.job.JobProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for ingest job execution.
 *
 * <p>Sets up a bounded thread pool for running ingest jobs. Jobs beyond {@code worker-threads}
 * wait in a queue of {@code queue-capacity}; when that is full, submission is rejected instead of
 * spawning more external tool processes.
 */
@Configuration
@EnableConfigurationProperties(JobProperties.class)
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public ThreadPoolTaskExecutor taskExecutor(JobProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.queueCapacity());
    executor.setThreadNamePrefix("ingest-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    executor.initialize();
    return executor;
  }
}
