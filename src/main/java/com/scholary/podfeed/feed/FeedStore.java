package com.scholary.podfeed.feed;

import java.util.List;
import java.util.Optional;

/**
 * Owner of the ordered, deduplicated collection of published entries.
 *
 * <p>Mutations are serialised; reads see a complete snapshot, either before or after any
 * concurrent mutation.
 */
public interface FeedStore {

  /**
   * Reconstruct the in-memory state from the persisted document.
   *
   * <p>A missing document yields an empty store.
   *
   * @throws FeedPersistException if the document exists but cannot be parsed
   */
  void load();

  /**
   * Insert an entry and persist the feed.
   *
   * <p>An id that is already present is a no-op and reports {@code duplicate=true}.
   *
   * @throws FeedPersistException if the feed cannot be persisted; the previous state remains
   */
  AddResult addEntry(FeedEntry entry);

  /**
   * Remove an entry and its backing media artifact. An unknown id reports {@code found=false}.
   *
   * @throws FeedPersistException if the feed cannot be persisted; the previous state remains
   */
  DeleteResult deleteEntry(String id);

  /**
   * Point every enclosure at the media storage's current URL for its artifact, persisting once if
   * anything changed. Needed after the public media base URL moves.
   *
   * @return number of entries whose URL was rewritten
   * @throws FeedPersistException if the feed cannot be persisted; the previous state remains
   */
  int rebaseMediaUrls();

  /** Entries newest first, truncated to the configured maximum. */
  List<FeedEntry> listEntries();

  Optional<FeedEntry> find(String id);

  default boolean contains(String id) {
    return find(id).isPresent();
  }

  /** The complete current state, uncapped. */
  FeedSnapshot snapshot();

  /** Outcome of {@link #addEntry}. */
  record AddResult(boolean added, boolean duplicate) {

    public static AddResult inserted() {
      return new AddResult(true, false);
    }

    public static AddResult alreadyPresent() {
      return new AddResult(false, true);
    }
  }

  /** Outcome of {@link #deleteEntry}. */
  record DeleteResult(boolean found) {}
}
