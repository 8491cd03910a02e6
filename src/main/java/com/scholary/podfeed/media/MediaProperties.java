package com.scholary.podfeed.media;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for media artifact storage.
 *
 * @param dir directory holding published audio files
 * @param baseUrl public URL prefix the directory is served under
 */
@ConfigurationProperties(prefix = "podfeed.media")
@Validated
public record MediaProperties(@NotBlank String dir, @NotBlank String baseUrl) {

  public String normalizedBaseUrl() {
    return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
  }
}
