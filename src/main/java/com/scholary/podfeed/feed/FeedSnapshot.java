package com.scholary.podfeed.feed;

import java.util.List;
import java.util.Optional;

/**
 * Immutable view of the whole feed at one revision.
 *
 * @param entries every entry, newest first (not capped)
 * @param revision incremented on each successful mutation since load
 */
public record FeedSnapshot(List<FeedEntry> entries, long revision) {

  public FeedSnapshot {
    entries = List.copyOf(entries);
  }

  public static FeedSnapshot empty() {
    return new FeedSnapshot(List.of(), 0L);
  }

  public Optional<FeedEntry> find(String id) {
    return entries.stream().filter(e -> e.id().equals(id)).findFirst();
  }

  public int size() {
    return entries.size();
  }
}
