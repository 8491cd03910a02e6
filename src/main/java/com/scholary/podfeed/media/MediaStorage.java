package com.scholary.podfeed.media;

import java.nio.file.Path;

/**
 * Abstraction for durable media artifact storage.
 *
 * <p>Published audio files live here, named after their entry id. Implementations must survive
 * process restarts. Serving the files to clients is someone else's job; this only knows the URL
 * they will be served under.
 */
public interface MediaStorage {

  /**
   * Move a finished artifact into storage.
   *
   * @param source the file to take over; it no longer exists afterwards
   * @param fileName the name to store it under
   * @return where it was stored and how large it is
   * @throws MediaStorageException if the move fails
   */
  StoredMedia store(Path source, String fileName);

  /**
   * Remove an artifact.
   *
   * @return true if something was deleted
   * @throws MediaStorageException if the file exists but cannot be deleted
   */
  boolean delete(String fileName);

  /** Whether an artifact is present under {@code fileName}. */
  boolean exists(String fileName);

  /** Public URL of an artifact, used as the feed enclosure URL. */
  String urlFor(String fileName);

  /** Stored artifact location. */
  record StoredMedia(String fileName, String url, long sizeBytes) {}
}
