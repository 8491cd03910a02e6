package com.scholary.podfeed.transcode;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/** Mime types for the audio containers podcast clients play directly. */
public final class AudioMimeTypes {

  private static final Map<String, String> BY_EXTENSION =
      Map.of(
          "mp3", "audio/mpeg",
          "m4a", "audio/mp4",
          "aac", "audio/aac",
          "ogg", "audio/ogg",
          "oga", "audio/ogg",
          "opus", "audio/opus",
          "flac", "audio/flac",
          "wav", "audio/wav");

  private static final Pattern EXTENSION_PATTERN = Pattern.compile("[a-z0-9]{1,8}");

  private AudioMimeTypes() {}

  public static Optional<String> forExtension(String extension) {
    if (extension == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_EXTENSION.get(extension.toLowerCase(Locale.ROOT)));
  }

  /**
   * Lower-case extension without the dot, or empty string. Anything that is not 1-8 ASCII letters
   * or digits counts as no extension, so client-supplied names cannot smuggle path separators.
   */
  public static String extensionOf(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot < 0) {
      return "";
    }
    String extension = fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    return EXTENSION_PATTERN.matcher(extension).matches() ? extension : "";
  }
}
