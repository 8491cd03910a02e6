package com.scholary.podfeed.feed;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.Objects;

/**
 * One published item of the feed.
 *
 * <p>Immutable. {@code publishedAt} is kept at second precision because that is all the persisted
 * RSS date format can carry; an entry compares equal to itself after a save/load cycle.
 *
 * @param id content-derived token, unique within the store
 * @param durationSeconds optional
 * @param mediaUrl enclosure URL; its last path segment is the artifact's file name
 * @param sourceLink optional link back to the original resource
 * @param imageUrl optional episode artwork
 */
public record FeedEntry(
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

  /** Newest first; id breaks ties so the order is deterministic. */
  public static final Comparator<FeedEntry> NEWEST_FIRST =
      Comparator.comparing(FeedEntry::publishedAt)
          .reversed()
          .thenComparing(FeedEntry::id);

  public FeedEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(mediaUrl, "mediaUrl");
    Objects.requireNonNull(publishedAt, "publishedAt");
    publishedAt = publishedAt.truncatedTo(ChronoUnit.SECONDS);
  }

  /** Same entry with its enclosure pointing at {@code url}. */
  public FeedEntry withMediaUrl(String url) {
    return new FeedEntry(
        id,
        title,
        description,
        durationSeconds,
        url,
        mimeType,
        fileSizeBytes,
        publishedAt,
        sourceLink,
        imageUrl);
  }

  /** Name of the backing artifact in media storage. */
  public String mediaFileName() {
    String path = URI.create(mediaUrl).getRawPath();
    String segment = path == null ? mediaUrl : path.substring(path.lastIndexOf('/') + 1);
    return URLDecoder.decode(segment, StandardCharsets.UTF_8);
  }
}
