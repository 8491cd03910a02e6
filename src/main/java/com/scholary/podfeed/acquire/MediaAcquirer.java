package com.scholary.podfeed.acquire;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podfeed.process.CommandResult;
import com.scholary.podfeed.process.CommandRunner;
import com.scholary.podfeed.process.CommandTimeoutException;
import com.scholary.podfeed.transcode.AudioMimeTypes;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Obtains raw media for a job.
 *
 * <p>Two modes:
 *
 * <ul>
 *   <li>Remote: runs the extraction tool (yt-dlp) for the best audio-bearing stream, relaying its
 *       progress lines to a {@link ProgressListener} and reading metadata from the info JSON it
 *       writes next to the media.
 *   <li>Local: moves already-received upload bytes into the scratch directory. Metadata is
 *       derived from the original file name.
 * </ul>
 *
 * <p>Either way the raw file ends up in the caller's scratch directory and the caller cleans it up.
 */
@Component
public class MediaAcquirer {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaAcquirer.class);

  private static final String INFO_JSON_SUFFIX = ".info.json";
  private static final List<String> IGNORED_SUFFIXES =
      List.of(INFO_JSON_SUFFIX, ".part", ".ytdl", ".temp", ".jpg", ".jpeg", ".png", ".webp");

  private final CommandRunner commandRunner;
  private final AcquireProperties properties;
  private final ObjectMapper objectMapper;

  public MediaAcquirer(
      CommandRunner commandRunner, AcquireProperties properties, ObjectMapper objectMapper) {
    this.commandRunner = commandRunner;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  /**
   * Download the best audio-bearing stream for a remote source.
   *
   * @param canonicalId the resolved source id, used as the scratch file's base name
   * @param locator the canonical locator handed to the tool
   * @param scratchDir the job's scratch directory
   * @param listener receives progress events
   * @return the raw file and its metadata
   * @throws AcquisitionException if the tool fails, times out, or produces no media
   * @throws InterruptedException if the job is cancelled while the tool runs
   */
  public AcquiredMedia acquireRemote(
      String canonicalId, String locator, Path scratchDir, ProgressListener listener)
      throws InterruptedException {
    LOGGER.info("Acquiring remote media: id={}, locator={}", canonicalId, locator);

    List<String> command = new ArrayList<>();
    command.add(properties.executable());
    command.add("--newline");
    command.add("--no-playlist");
    command.add("--no-part");
    command.add("--write-info-json");
    command.add("-f");
    command.add(properties.format());
    command.add("-o");
    command.add(scratchDir.resolve(canonicalId + ".%(ext)s").toString());
    command.addAll(properties.extraArgs());
    command.add(locator);

    CommandResult result;
    try {
      Files.createDirectories(scratchDir);
      result =
          commandRunner.run(
              command,
              properties.timeout(),
              line -> DownloadProgressParser.parse(line).ifPresent(listener::onProgress));
    } catch (CommandTimeoutException e) {
      throw new AcquisitionException("Download timed out: " + e.getMessage(), e);
    } catch (IOException e) {
      throw new AcquisitionException("Failed to run extraction tool: " + e.getMessage(), e);
    }

    if (!result.succeeded()) {
      throw new AcquisitionException(
          String.format("Download failed (exit %d): %s", result.exitCode(), result.tail(5)));
    }

    Path rawFile =
        findMediaFile(scratchDir, canonicalId)
            .orElseThrow(
                () -> new AcquisitionException("Extraction tool produced no media file"));
    MediaMetadata metadata = readInfoJson(scratchDir.resolve(canonicalId + INFO_JSON_SUFFIX));

    LOGGER.info(
        "Acquired remote media: file={}, title={}", rawFile.getFileName(), metadata.title());
    return new AcquiredMedia(rawFile, metadata);
  }

  /**
   * Take over bytes that were already uploaded.
   *
   * @param uploadPath where the upload was received
   * @param originalName the client's file name, used for the extension and a fallback title
   * @param scratchDir the job's scratch directory
   * @throws AcquisitionException if the upload is missing or cannot be moved
   */
  public AcquiredMedia acquireLocal(Path uploadPath, String originalName, Path scratchDir) {
    if (!Files.isRegularFile(uploadPath)) {
      throw new AcquisitionException("Uploaded file not found: " + uploadPath.getFileName());
    }
    String name = originalName != null ? originalName : uploadPath.getFileName().toString();
    String extension = AudioMimeTypes.extensionOf(name);
    Path rawFile = scratchDir.resolve(extension.isEmpty() ? "upload" : "upload." + extension);

    try {
      Files.createDirectories(scratchDir);
      Files.move(uploadPath, rawFile, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      throw new AcquisitionException("Failed to stage uploaded file: " + e.getMessage(), e);
    }

    LOGGER.info("Staged uploaded media: name={}, file={}", name, rawFile.getFileName());
    return new AcquiredMedia(rawFile, MediaMetadata.fromFileName(name));
  }

  private Optional<Path> findMediaFile(Path scratchDir, String canonicalId) {
    String prefix = canonicalId + ".";
    try (Stream<Path> files = Files.list(scratchDir)) {
      return files
          .filter(Files::isRegularFile)
          .filter(p -> p.getFileName().toString().startsWith(prefix))
          .filter(p -> IGNORED_SUFFIXES.stream().noneMatch(s -> p.toString().endsWith(s)))
          .max(Comparator.comparingLong(MediaAcquirer::sizeOf));
    } catch (IOException e) {
      throw new AcquisitionException("Failed to list scratch directory: " + e.getMessage(), e);
    }
  }

  private MediaMetadata readInfoJson(Path infoJson) {
    if (!Files.isRegularFile(infoJson)) {
      LOGGER.warn("No metadata file written by extraction tool: {}", infoJson.getFileName());
      return MediaMetadata.empty();
    }
    try {
      JsonNode info = objectMapper.readTree(infoJson.toFile());
      JsonNode duration = info.path("duration");
      return new MediaMetadata(
          text(info, "title"),
          text(info, "description"),
          duration.isNumber() ? Math.round(duration.asDouble()) : null,
          text(info, "thumbnail"));
    } catch (IOException e) {
      LOGGER.warn("Unreadable metadata file {}: {}", infoJson.getFileName(), e.getMessage());
      return MediaMetadata.empty();
    }
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static long sizeOf(Path path) {
    try {
      return Files.size(path);
    } catch (IOException e) {
      return -1L;
    }
  }
}
