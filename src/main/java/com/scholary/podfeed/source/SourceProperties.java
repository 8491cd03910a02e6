package com.scholary.podfeed.source;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for source locator recognition.
 *
 * <p>The host lists and id pattern decide which locators are accepted; the template builds the
 * canonical locator handed to the extraction tool.
 */
@ConfigurationProperties(prefix = "podfeed.source")
@Validated
public record SourceProperties(
    @NotEmpty List<String> hosts,
    List<String> shortHosts,
    @NotBlank String idPattern,
    @NotBlank String canonicalUrlTemplate) {

  public SourceProperties {
    shortHosts = shortHosts == null ? List.of() : List.copyOf(shortHosts);
    hosts = List.copyOf(hosts);
  }
}
