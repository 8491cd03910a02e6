package com.scholary.podfeed.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request to ingest a remote source.
 *
 * <p>{@code title} and {@code description} override what the extraction tool reports.
 */
public record SubmitRequest(
    @NotBlank @Size(max = 2048) String url,
    @Size(max = 500) String title,
    @Size(max = 10000) String description) {}
