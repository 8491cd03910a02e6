package com.scholary.podfeed.source;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Caller-supplied pointer to media: either a remote locator or bytes that were already uploaded.
 *
 * <p>Immutable once a job is created. Use the factory methods rather than the canonical
 * constructor so the fields that belong to the other kind stay null.
 */
public record SourceReference(Kind kind, String locator, Path uploadPath, String originalName) {

  public enum Kind {
    REMOTE_LOCATOR,
    UPLOADED_BYTES
  }

  public SourceReference {
    Objects.requireNonNull(kind, "kind");
    if (kind == Kind.REMOTE_LOCATOR && locator == null) {
      throw new IllegalArgumentException("Remote source requires a locator");
    }
    if (kind == Kind.UPLOADED_BYTES && uploadPath == null) {
      throw new IllegalArgumentException("Uploaded source requires a path");
    }
  }

  public static SourceReference remote(String locator) {
    return new SourceReference(Kind.REMOTE_LOCATOR, locator, null, null);
  }

  public static SourceReference uploaded(Path uploadPath, String originalName) {
    return new SourceReference(Kind.UPLOADED_BYTES, null, uploadPath, originalName);
  }

  public boolean isRemote() {
    return kind == Kind.REMOTE_LOCATOR;
  }

  /** Short label used in logs and job status. */
  public String describe() {
    return isRemote() ? locator : originalName != null ? originalName : uploadPath.toString();
  }
}
