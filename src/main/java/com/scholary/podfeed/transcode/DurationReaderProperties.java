package com.scholary.podfeed.transcode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for ffprobe. */
@ConfigurationProperties(prefix = "podfeed.duration-reader")
@Validated
public record DurationReaderProperties(@NotBlank String executable, @NotNull Duration timeout) {}
