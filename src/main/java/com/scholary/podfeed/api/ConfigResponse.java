package com.scholary.podfeed.api;

/** Public settings a client needs to present the feed. */
public record ConfigResponse(
    String feedTitle, String feedDescription, String siteUrl, String audioFormat, int maxItems) {}
