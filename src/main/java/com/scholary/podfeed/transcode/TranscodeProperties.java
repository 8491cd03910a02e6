package com.scholary.podfeed.transcode;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the encode step.
 *
 * <p>One canonical format for the whole feed. The defaults are tuned for speech: VBR quality 2
 * (~190 kbps), 44.1 kHz stereo.
 */
@ConfigurationProperties(prefix = "podfeed.transcode")
@Validated
public record TranscodeProperties(
    @NotBlank String executable,
    @NotBlank String codec,
    @NotBlank String extension,
    @NotBlank String mimeType,
    @Min(0) @Max(9) int quality,
    @Positive int sampleRate,
    @Positive int channels,
    @NotNull Duration timeout,
    List<String> fallbackExtensions) {

  public TranscodeProperties {
    extension = extension.toLowerCase(Locale.ROOT);
    fallbackExtensions =
        fallbackExtensions == null
            ? List.of()
            : fallbackExtensions.stream().map(e -> e.toLowerCase(Locale.ROOT)).toList();
  }
}
