package com.scholary.podfeed.feed;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the persisted feed and its channel metadata.
 *
 * @param file path of the RSS document
 * @param maxItems presentation cap for listings; never deletes anything
 */
@ConfigurationProperties(prefix = "podfeed.feed")
@Validated
public record FeedProperties(
    @NotBlank String file,
    @Positive int maxItems,
    @NotBlank String title,
    @NotBlank String description,
    @NotBlank String siteUrl,
    @NotBlank String language,
    @NotBlank String author,
    String category,
    String imageUrl) {}
