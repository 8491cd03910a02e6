package com.scholary.podfeed.api;

/** Result of deleting an entry; {@code found=false} means there was nothing to delete. */
public record DeleteEntryResponse(String id, boolean found) {}
