package com.scholary.podfeed.feed;

import com.scholary.podfeed.media.MediaStorage;
import com.scholary.podfeed.media.MediaStorageException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FeedStore} persisted as a single RSS document on the local filesystem.
 *
 * <p>Concurrency model:
 *
 * <ul>
 *   <li>Readers take the current {@link FeedSnapshot} from a volatile field, never locking.
 *   <li>Writers hold {@code writeLock} for the whole read-modify-persist cycle, so at most one
 *       mutation runs at a time.
 *   <li>The snapshot is swapped only after the document has been replaced on disk. A failed
 *       persist leaves memory and disk exactly as they were.
 * </ul>
 *
 * <p>The document always carries every entry; {@code maxItems} only caps {@link #listEntries()}.
 */
public class RssFeedStore implements FeedStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(RssFeedStore.class);

  private final Path feedFile;
  private final int maxItems;
  private final FeedDocumentCodec codec;
  private final MediaStorage mediaStorage;
  private final Clock clock;
  private final ReentrantLock writeLock = new ReentrantLock();

  private volatile FeedSnapshot snapshot = FeedSnapshot.empty();

  public RssFeedStore(
      FeedProperties properties,
      FeedDocumentCodec codec,
      MediaStorage mediaStorage,
      Clock clock) {
    this.feedFile = Paths.get(properties.file());
    this.maxItems = properties.maxItems();
    this.codec = codec;
    this.mediaStorage = mediaStorage;
    this.clock = clock;
  }

  @Override
  public void load() {
    writeLock.lock();
    try {
      int stale = AtomicFileWriter.removeStaleTempFiles(feedFile);
      if (stale > 0) {
        LOGGER.warn("Removed {} stale temp file(s) next to {}", stale, feedFile);
      }

      if (!Files.exists(feedFile)) {
        LOGGER.info("No feed document at {}, starting empty", feedFile);
        snapshot = FeedSnapshot.empty();
        return;
      }

      List<FeedEntry> parsed;
      try (InputStream in = Files.newInputStream(feedFile)) {
        parsed = codec.read(in);
      }
      snapshot = new FeedSnapshot(dedupeAndSort(parsed), 0L);
      LOGGER.info("Loaded {} entries from {}", snapshot.size(), feedFile);
    } catch (IOException e) {
      throw new FeedPersistException("Failed to read feed document " + feedFile, e);
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public AddResult addEntry(FeedEntry entry) {
    writeLock.lock();
    try {
      FeedSnapshot current = snapshot;
      if (current.find(entry.id()).isPresent()) {
        LOGGER.info("Entry already in feed: id={}", entry.id());
        return AddResult.alreadyPresent();
      }

      List<FeedEntry> updated = new ArrayList<>(current.entries());
      updated.add(entry);
      updated.sort(FeedEntry.NEWEST_FIRST);

      persist(updated);
      snapshot = new FeedSnapshot(updated, current.revision() + 1);

      LOGGER.info(
          "Added feed entry: id={}, title={}, entries={}", entry.id(), entry.title(), updated.size());
      return AddResult.inserted();
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public DeleteResult deleteEntry(String id) {
    FeedEntry removed;
    writeLock.lock();
    try {
      FeedSnapshot current = snapshot;
      Optional<FeedEntry> existing = current.find(id);
      if (existing.isEmpty()) {
        return new DeleteResult(false);
      }
      removed = existing.get();

      List<FeedEntry> updated = new ArrayList<>(current.entries());
      updated.remove(removed);

      persist(updated);
      snapshot = new FeedSnapshot(updated, current.revision() + 1);
    } finally {
      writeLock.unlock();
    }

    LOGGER.info("Deleted feed entry: id={}", id);
    deleteArtifact(removed);
    return new DeleteResult(true);
  }

  @Override
  public int rebaseMediaUrls() {
    writeLock.lock();
    try {
      FeedSnapshot current = snapshot;
      List<FeedEntry> updated = new ArrayList<>(current.size());
      int changed = 0;
      for (FeedEntry entry : current.entries()) {
        FeedEntry rebased = rebase(entry);
        if (rebased != entry) {
          changed++;
        }
        updated.add(rebased);
      }
      if (changed == 0) {
        return 0;
      }

      persist(updated);
      snapshot = new FeedSnapshot(updated, current.revision() + 1);
      LOGGER.info("Rebased media URLs: changed={}, entries={}", changed, updated.size());
      return changed;
    } finally {
      writeLock.unlock();
    }
  }

  @Override
  public List<FeedEntry> listEntries() {
    List<FeedEntry> entries = snapshot.entries();
    return entries.size() <= maxItems ? entries : entries.subList(0, maxItems);
  }

  @Override
  public Optional<FeedEntry> find(String id) {
    return snapshot.find(id);
  }

  @Override
  public FeedSnapshot snapshot() {
    return snapshot;
  }

  private void persist(List<FeedEntry> entries) {
    try {
      AtomicFileWriter.write(feedFile, out -> codec.write(entries, clock.instant(), out));
    } catch (IOException | RuntimeException e) {
      throw new FeedPersistException("Failed to persist feed document " + feedFile, e);
    }
  }

  private FeedEntry rebase(FeedEntry entry) {
    String fileName = entry.mediaFileName();
    try {
      if (!mediaStorage.exists(fileName)) {
        LOGGER.warn("Media artifact missing: entryId={}, file={}", entry.id(), fileName);
      }
    } catch (IllegalArgumentException e) {
      LOGGER.warn(
          "Enclosure URL has no usable file name: entryId={}, url={}",
          entry.id(),
          entry.mediaUrl());
      return entry;
    }
    String url = mediaStorage.urlFor(fileName);
    return url.equals(entry.mediaUrl()) ? entry : entry.withMediaUrl(url);
  }

  private void deleteArtifact(FeedEntry entry) {
    String fileName = entry.mediaFileName();
    try {
      if (!mediaStorage.delete(fileName)) {
        LOGGER.warn("Media artifact already absent: entryId={}, file={}", entry.id(), fileName);
      }
    } catch (MediaStorageException e) {
      // The entry is gone from the feed; an orphaned file is harmless.
      LOGGER.warn("Failed to delete media artifact: entryId={}, file={}", entry.id(), fileName, e);
    }
  }

  private static List<FeedEntry> dedupeAndSort(List<FeedEntry> parsed) {
    Map<String, FeedEntry> byId = new LinkedHashMap<>();
    for (FeedEntry entry : parsed) {
      if (byId.putIfAbsent(entry.id(), entry) != null) {
        LOGGER.warn("Ignoring repeated feed entry in document: id={}", entry.id());
      }
    }
    List<FeedEntry> sorted = new ArrayList<>(byId.values());
    sorted.sort(FeedEntry.NEWEST_FIRST);
    return sorted;
  }
}
