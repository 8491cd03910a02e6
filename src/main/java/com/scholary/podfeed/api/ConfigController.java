package com.scholary.podfeed.api;

import com.scholary.podfeed.feed.FeedProperties;
import com.scholary.podfeed.transcode.TranscodeProperties;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Config", description = "Public feed settings")
public class ConfigController {

  private final FeedProperties feedProperties;
  private final TranscodeProperties transcodeProperties;

  public ConfigController(FeedProperties feedProperties, TranscodeProperties transcodeProperties) {
    this.feedProperties = feedProperties;
    this.transcodeProperties = transcodeProperties;
  }

  @GetMapping("/api/config")
  @Operation(summary = "Get config", description = "Feed title, site URL and audio format")
  public ConfigResponse config() {
    return new ConfigResponse(
        feedProperties.title(),
        feedProperties.description(),
        feedProperties.siteUrl(),
        transcodeProperties.extension(),
        feedProperties.maxItems());
  }
}
