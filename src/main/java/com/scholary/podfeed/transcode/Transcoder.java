package com.scholary.podfeed.transcode;

import com.scholary.podfeed.logging.PipelineLogger;
import com.scholary.podfeed.process.CommandResult;
import com.scholary.podfeed.process.CommandRunner;
import com.scholary.podfeed.process.CommandTimeoutException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts acquired media into the feed's canonical audio format using ffmpeg.
 *
 * <p>The encode is a compatibility normalization, not a correctness requirement, so encoder
 * failures go through a fallback policy:
 *
 * <ol>
 *   <li>Raw file already in the canonical format: no encode, file is used as is.
 *   <li>Encode succeeds: the canonical file replaces the raw file, which is deleted.
 *   <li>Encode fails and the raw file is a playable audio container: the raw file is kept as the
 *       final artifact and a warning is returned.
 *   <li>Encode fails otherwise (video-only, unknown container): {@link TranscodeException}.
 * </ol>
 */
@Component
public class Transcoder {

  private static final Logger LOGGER = LoggerFactory.getLogger(Transcoder.class);
  private final PipelineLogger pipelineLogger = new PipelineLogger(LOGGER);

  private final CommandRunner commandRunner;
  private final TranscodeProperties properties;

  public Transcoder(CommandRunner commandRunner, TranscodeProperties properties) {
    this.commandRunner = commandRunner;
    this.properties = properties;
  }

  /**
   * Encode a raw file.
   *
   * @param rawFile the acquired media
   * @param outputBaseName base name of the canonical output, written next to the raw file
   * @return the artifact to publish
   * @throws TranscodeException if encoding failed with no usable fallback
   * @throws InterruptedException if the job is cancelled while the encoder runs
   */
  public TranscodeResult transcode(Path rawFile, String outputBaseName)
      throws InterruptedException {
    String rawExtension = AudioMimeTypes.extensionOf(rawFile.getFileName().toString());
    Path output = rawFile.resolveSibling(outputBaseName + "." + properties.extension());

    if (rawExtension.equals(properties.extension())) {
      LOGGER.info("File is already {}, skipping encode: {}", rawExtension, rawFile.getFileName());
      return new TranscodeResult(moveIfNeeded(rawFile, output), properties.mimeType(), false, null);
    }

    LOGGER.info(
        "Encoding {} to {} (codec={}, q:a={})",
        rawFile.getFileName(),
        output.getFileName(),
        properties.codec(),
        properties.quality());

    String failure = encode(rawFile, output);
    if (failure == null) {
      deleteQuietly(rawFile);
      return new TranscodeResult(output, properties.mimeType(), true, null);
    }

    deleteQuietly(output);
    if (properties.fallbackExtensions().contains(rawExtension)) {
      String mimeType = AudioMimeTypes.forExtension(rawExtension).orElse("audio/" + rawExtension);
      pipelineLogger.logTranscodeFallback(rawFile.getFileName().toString(), failure);
      String warning =
          String.format("Encoder failed (%s); published untranscoded .%s file", failure, rawExtension);
      return new TranscodeResult(rawFile, mimeType, false, warning);
    }

    throw new TranscodeException("Transcoding failed: " + failure);
  }

  /** @return null on success, otherwise a short reason */
  private String encode(Path input, Path output) throws InterruptedException {
    // -vn: drop video/cover streams, -y: overwrite
    List<String> command =
        List.of(
            properties.executable(),
            "-hide_banner",
            "-loglevel",
            "error",
            "-y",
            "-i",
            input.toString(),
            "-vn",
            "-c:a",
            properties.codec(),
            "-q:a",
            String.valueOf(properties.quality()),
            "-ar",
            String.valueOf(properties.sampleRate()),
            "-ac",
            String.valueOf(properties.channels()),
            output.toString());

    CommandResult result;
    try {
      result = commandRunner.run(command, properties.timeout());
    } catch (CommandTimeoutException e) {
      return "timed out after " + e.getTimeout().toSeconds() + "s";
    } catch (IOException e) {
      return "could not run encoder: " + e.getMessage();
    }

    if (!result.succeeded()) {
      String detail = result.tail(3);
      return detail.isBlank()
          ? "exit code " + result.exitCode()
          : "exit code " + result.exitCode() + ": " + detail;
    }
    try {
      if (!Files.isRegularFile(output) || Files.size(output) == 0) {
        return "encoder produced no output";
      }
    } catch (IOException e) {
      return "unreadable encoder output: " + e.getMessage();
    }
    return null;
  }

  private Path moveIfNeeded(Path from, Path to) {
    if (from.equals(to)) {
      return from;
    }
    try {
      return Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new TranscodeException("Failed to rename " + from.getFileName(), e);
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }
}
