package com.scholary.podfeed.transcode;

import java.nio.file.Path;

/**
 * Final audio artifact of the encode step.
 *
 * @param artifact the file to publish
 * @param mimeType its mime type
 * @param transcoded false when the raw file was kept (already canonical, or fallback)
 * @param warning non-null when the encoder failed and the fallback policy kept the raw file
 */
public record TranscodeResult(Path artifact, String mimeType, boolean transcoded, String warning) {

  public boolean fellBack() {
    return warning != null;
  }
}
