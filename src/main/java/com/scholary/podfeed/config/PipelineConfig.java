package com.scholary.podfeed.config;

import com.scholary.podfeed.acquire.AcquireProperties;
import com.scholary.podfeed.source.SourceProperties;
import com.scholary.podfeed.transcode.DurationReaderProperties;
import com.scholary.podfeed.transcode.TranscodeProperties;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the pipeline stages.
 *
 * <p>Enables the resolver, acquirer, transcoder and durationReader properties to be loaded from
 * application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  SourceProperties.class,
  AcquireProperties.class,
  TranscodeProperties.class,
  DurationReaderProperties.class
})
public class PipelineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
