package com.scholary.podfeed.config;

import com.scholary.podfeed.feed.FeedDocumentCodec;
import com.scholary.podfeed.feed.FeedProperties;
import com.scholary.podfeed.feed.FeedStore;
import com.scholary.podfeed.feed.RssFeedStore;
import com.scholary.podfeed.media.LocalMediaStorage;
import com.scholary.podfeed.media.MediaProperties;
import com.scholary.podfeed.media.MediaStorage;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the feed store and media storage.
 *
 * <p>The feed store is loaded while the context starts, so a corrupt feed document stops the
 * application instead of being overwritten later. Enclosure URLs written under a previous
 * {@code podfeed.media.base-url} are rebased right after loading.
 */
@Configuration
@EnableConfigurationProperties({FeedProperties.class, MediaProperties.class})
public class FeedConfig {

  @Bean
  public MediaStorage mediaStorage(MediaProperties properties) {
    return new LocalMediaStorage(properties);
  }

  @Bean
  public FeedDocumentCodec feedDocumentCodec(FeedProperties properties) {
    return new FeedDocumentCodec(properties);
  }

  @Bean
  public FeedStore feedStore(
      FeedProperties properties,
      FeedDocumentCodec codec,
      MediaStorage mediaStorage,
      Clock clock) {
    RssFeedStore store = new RssFeedStore(properties, codec, mediaStorage, clock);
    store.load();
    store.rebaseMediaUrls();
    return store;
  }
}
