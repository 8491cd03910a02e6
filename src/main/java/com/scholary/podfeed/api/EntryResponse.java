package com.scholary.podfeed.api;

import com.scholary.podfeed.feed.FeedEntry;
import java.time.Instant;

/** One feed entry as listed by the API. */
public record EntryResponse(
    String id,
    String title,
    String description,
    Long durationSeconds,
    String mediaUrl,
    String mimeType,
    long fileSizeBytes,
    Instant publishedAt,
    String sourceLink,
    String imageUrl) {

  public static EntryResponse from(FeedEntry entry) {
    return new EntryResponse(
        entry.id(),
        entry.title(),
        entry.description(),
        entry.durationSeconds(),
        entry.mediaUrl(),
        entry.mimeType(),
        entry.fileSizeBytes(),
        entry.publishedAt(),
        entry.sourceLink(),
        entry.imageUrl());
  }
}
