package com.scholary.podfeed.transcode;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podfeed.process.CommandResult;
import com.scholary.podfeed.process.CommandRunner;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads the duration of an audio file with ffprobe.
 *
 * <p>Used for uploads, where no extraction tool reported one. A failed read is not an error; the
 * entry is simply published without a duration.
 */
@Component
public class DurationReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(DurationReader.class);

  private final CommandRunner commandRunner;
  private final DurationReaderProperties properties;
  private final ObjectMapper objectMapper;

  public DurationReader(
      CommandRunner commandRunner, DurationReaderProperties properties, ObjectMapper objectMapper) {
    this.commandRunner = commandRunner;
    this.properties = properties;
    this.objectMapper = objectMapper;
  }

  /**
   * Read the duration of a file.
   *
   * @return whole seconds, or empty if ffprobe failed or reported none
   * @throws InterruptedException if the job is cancelled while ffprobe runs
   */
  public Optional<Long> durationSeconds(Path file) throws InterruptedException {
    List<String> command =
        List.of(
            properties.executable(),
            "-v",
            "quiet",
            "-print_format",
            "json",
            "-show_format",
            file.toString());
    try {
      CommandResult result = commandRunner.run(command, properties.timeout());
      if (!result.succeeded()) {
        LOGGER.warn("ffprobe exited with code {} for {}", result.exitCode(), file.getFileName());
        return Optional.empty();
      }
      JsonNode duration = objectMapper.readTree(result.stdout()).path("format").path("duration");
      if (duration.isMissingNode() || duration.asText().isBlank()) {
        return Optional.empty();
      }
      return Optional.of(Math.round(Double.parseDouble(duration.asText())));
    } catch (IOException | NumberFormatException e) {
      LOGGER.warn("Could not read duration of {}: {}", file.getFileName(), e.getMessage());
      return Optional.empty();
    }
  }
}
