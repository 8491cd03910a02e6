package com.scholary.podfeed.media;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.UriUtils;

/**
 * Filesystem implementation of {@link MediaStorage}.
 *
 * <p>Files are staged under a temporary name in the media directory and then renamed, so a
 * half-copied artifact is never visible under its final name (matters when scratch and media live
 * on different filesystems).
 */
public class LocalMediaStorage implements MediaStorage {

  private static final Logger LOGGER = LoggerFactory.getLogger(LocalMediaStorage.class);

  private final Path mediaDir;
  private final String baseUrl;

  public LocalMediaStorage(MediaProperties properties) {
    this.mediaDir = Paths.get(properties.dir());
    this.baseUrl = properties.normalizedBaseUrl();

    try {
      Files.createDirectories(mediaDir);
    } catch (IOException e) {
      throw new MediaStorageException("Failed to create media directory: " + mediaDir, e);
    }
    LOGGER.info("Initialized media storage: dir={}, baseUrl={}", mediaDir, baseUrl);
  }

  @Override
  public StoredMedia store(Path source, String fileName) {
    Path target = resolve(fileName);
    Path staging = mediaDir.resolve("." + fileName + ".incoming");
    try {
      Files.move(source, staging, StandardCopyOption.REPLACE_EXISTING);
      Files.move(staging, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      long size = Files.size(target);
      LOGGER.info("Stored media: file={}, size={} bytes", fileName, size);
      return new StoredMedia(fileName, urlFor(fileName), size);
    } catch (IOException e) {
      try {
        Files.deleteIfExists(staging);
      } catch (IOException suppressed) {
        e.addSuppressed(suppressed);
      }
      throw new MediaStorageException("Failed to store media file " + fileName, e);
    }
  }

  @Override
  public boolean delete(String fileName) {
    try {
      boolean deleted = Files.deleteIfExists(resolve(fileName));
      LOGGER.info("Deleted media: file={}, existed={}", fileName, deleted);
      return deleted;
    } catch (IOException e) {
      throw new MediaStorageException("Failed to delete media file " + fileName, e);
    }
  }

  @Override
  public boolean exists(String fileName) {
    return Files.isRegularFile(resolve(fileName));
  }

  @Override
  public String urlFor(String fileName) {
    return baseUrl + "/" + UriUtils.encodePathSegment(fileName, StandardCharsets.UTF_8);
  }

  private Path resolve(String fileName) {
    if (fileName == null
        || fileName.isBlank()
        || fileName.contains("/")
        || fileName.contains("\\")
        || fileName.startsWith(".")) {
      throw new IllegalArgumentException("Invalid media file name: " + fileName);
    }
    return mediaDir.resolve(fileName);
  }
}
