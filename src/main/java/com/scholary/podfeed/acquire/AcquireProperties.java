package com.scholary.podfeed.acquire;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the extraction tool.
 *
 * <p>{@code extraArgs} are appended before the locator, for cookies, proxies and the like.
 */
@ConfigurationProperties(prefix = "podfeed.acquire")
@Validated
public record AcquireProperties(
    @NotBlank String executable,
    @NotBlank String format,
    @NotNull Duration timeout,
    List<String> extraArgs) {

  public AcquireProperties {
    extraArgs = extraArgs == null ? List.of() : List.copyOf(extraArgs);
  }
}
