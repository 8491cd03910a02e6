package com.scholary.podfeed.acquire;

import java.util.Locale;

/**
 * Descriptive metadata for acquired media. Every field may be null.
 *
 * @param durationSeconds length in whole seconds when the tool reported it
 * @param thumbnailUrl preview image published as the episode artwork
 */
public record MediaMetadata(
    String title,
    String description,
    Long durationSeconds,
    String thumbnailUrl) {

  public static MediaMetadata empty() {
    return new MediaMetadata(null, null, null, null);
  }

  /**
   * Derive a display title from an uploaded file name: extension dropped, separators turned into
   * spaces.
   */
  public static MediaMetadata fromFileName(String fileName) {
    if (fileName == null || fileName.isBlank()) {
      return empty();
    }
    String base = fileName;
    int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
    if (slash >= 0) {
      base = base.substring(slash + 1);
    }
    int dot = base.lastIndexOf('.');
    if (dot > 0) {
      base = base.substring(0, dot);
    }
    String title = base.replace('_', ' ').replace('-', ' ').replaceAll("\\s+", " ").trim();
    if (title.isEmpty()) {
      title = fileName.toLowerCase(Locale.ROOT);
    }
    return new MediaMetadata(title, null, null, null);
  }
}
