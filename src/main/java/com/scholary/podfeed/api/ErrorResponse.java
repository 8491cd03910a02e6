package com.scholary.podfeed.api;

/** Error body returned by every failing endpoint. */
public record ErrorResponse(String error, String category) {}
